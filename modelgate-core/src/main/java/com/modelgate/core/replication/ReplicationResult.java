package com.modelgate.core.replication;

import com.modelgate.core.change.Conflict;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 一次复制的结果
 */
@Getter
@Builder
@ToString
public class ReplicationResult {

    @Builder.Default
    private final List<Conflict> conflicts = List.of();

    /**
     * 本轮开始时推进得到的新 checkpoint，作为下一轮的 since
     */
    private final Checkpoints checkpoints;

    /**
     * 已成功应用到目标端的更新
     */
    @Builder.Default
    private final List<Update> updates = List.of();

    /**
     * 只存在于目标端的差异，供反向复制参考，不会被应用
     */
    @Builder.Default
    private final List<Delta> targetDeltas = List.of();

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
