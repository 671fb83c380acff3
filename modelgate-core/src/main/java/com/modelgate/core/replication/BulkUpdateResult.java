package com.modelgate.core.replication;

import java.util.List;

/**
 * bulkUpdate 结果
 *
 * @param count   成功应用的更新数
 * @param results 每条更新的结果
 */
public record BulkUpdateResult(int count, List<Entry> results) {

    public enum Action {
        CREATE, UPDATE, DELETE, SKIP
    }

    public record Entry(Object id, Action action, boolean success) {
    }
}
