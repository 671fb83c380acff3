package com.modelgate.core.replication;

import com.modelgate.core.store.Filter;
import lombok.Builder;
import lombok.Data;

/**
 * 复制选项
 */
@Data
@Builder
public class ReplicationOptions {

    /**
     * 只复制满足条件的实体
     */
    private Filter filter;

    public static ReplicationOptions defaults() {
        return ReplicationOptions.builder().build();
    }
}
