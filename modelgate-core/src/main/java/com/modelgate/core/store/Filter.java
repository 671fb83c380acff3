package com.modelgate.core.store;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 查询过滤器
 */
@Data
@Builder(toBuilder = true)
public class Filter {

    private Where where;

    /**
     * 投影字段，null 或空表示全部字段
     */
    private List<String> fields;

    /**
     * 排序，形如 "seq DESC" 或 "name ASC, id DESC"
     */
    private String order;

    private Integer skip;
    private Integer limit;

    public static Filter where(Where where) {
        return Filter.builder().where(where).build();
    }

    public static Filter all() {
        return Filter.builder().build();
    }
}
