package com.modelgate.core.spi;

import com.modelgate.core.store.Filter;
import com.modelgate.core.store.Where;

import java.util.List;
import java.util.Map;

/**
 * SPI: 持久化能力集
 * <p>
 * 每个实体集合一个实例。文档以 {@code Map<String, Object>} 表示。
 * 单条 create / update / delete 由实现保证原子性，跨记录操作不保证。
 * 存储故障以 RuntimeException 原样抛出，Core 不做包装与重试。
 * </p>
 */
public interface ModelStore {

    String getModelName();

    default String getIdName() {
        return "id";
    }

    /**
     * 创建记录，未给出 ID 时由存储生成
     */
    Map<String, Object> create(Map<String, Object> data);

    Map<String, Object> findById(Object id);

    default Map<String, Object> findOne(Filter filter) {
        Filter limited = (filter == null ? Filter.all() : filter).toBuilder().limit(1).build();
        List<Map<String, Object>> found = find(limited);
        return found.isEmpty() ? null : found.get(0);
    }

    List<Map<String, Object>> find(Filter filter);

    /**
     * 局部更新，记录不存在时抛出 NotFoundException
     */
    Map<String, Object> updateAttributes(Object id, Map<String, Object> data);

    /**
     * 整体替换或创建
     */
    Map<String, Object> replaceOrCreate(Map<String, Object> data);

    /**
     * @return 是否删除了记录
     */
    boolean destroyById(Object id);

    int destroyAll(Where where);

    int count(Where where);

    /**
     * @return 更新的记录数
     */
    int updateAll(Where where, Map<String, Object> data);
}
