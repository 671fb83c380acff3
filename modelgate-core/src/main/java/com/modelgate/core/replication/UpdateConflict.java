package com.modelgate.core.replication;

import com.modelgate.core.change.ChangeType;

/**
 * bulkUpdate 中单条记录的冲突
 *
 * @param modelId     实体 ID
 * @param type        更新类型
 * @param expectedRev 更新声明的目标端前置 revision
 * @param actualRev   目标端实际 revision，记录不存在时为 null
 * @param reason      描述
 */
public record UpdateConflict(Object modelId, ChangeType type, String expectedRev, String actualRev, String reason) {
}
