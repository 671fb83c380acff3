package com.modelgate.core.replication;

import com.modelgate.core.change.Change;
import com.modelgate.core.change.ChangeTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 差异引擎
 * <p>
 * 以目标端自 since 以来的变更为基准，逐条与同 modelId 的源端变更配对：
 * <ul>
 *     <li>rev 相同：已对齐</li>
 *     <li>conflictsWith：冲突</li>
 *     <li>目标端基于源端 (目标端领先)：TARGET 差异</li>
 *     <li>其他：SOURCE 差异</li>
 * </ul>
 * 未配对的目标端变更为 TARGET 差异，未配对的源端变更为 SOURCE 差异。结果只保证完整，不保证顺序。
 * </p>
 */
@Slf4j
public class DiffEngine {

    public DiffResult diff(ChangeTracker target, long since, List<Change> sourceChanges) {
        List<Change> targetChanges = target.changes(since, null);

        Map<String, Change> sourceById = new LinkedHashMap<>();
        for (Change change : sourceChanges) {
            sourceById.put(DiffResult.key(change.getModelId()), change);
        }

        List<Delta> deltas = new ArrayList<>();
        List<Change> conflicts = new ArrayList<>();
        List<Object> reconciled = new ArrayList<>();

        for (Change targetChange : targetChanges) {
            Change sourceChange = sourceById.remove(DiffResult.key(targetChange.getModelId()));
            if (sourceChange == null) {
                deltas.add(Delta.target(targetChange));
            } else if (sourceChange.sameRevision(targetChange)) {
                reconciled.add(targetChange.getModelId());
            } else if (sourceChange.conflictsWith(targetChange)) {
                conflicts.add(sourceChange);
            } else if (targetChange.isBasedOn(sourceChange)) {
                deltas.add(Delta.target(targetChange));
            } else {
                deltas.add(Delta.source(sourceChange));
            }
        }
        for (Change remaining : sourceById.values()) {
            deltas.add(Delta.source(remaining));
        }

        log.debug("diff {} since {}: {} target changes, {} source changes -> {} deltas, {} conflicts, {} reconciled",
                target.getModelName(), since, targetChanges.size(), sourceChanges.size(),
                deltas.size(), conflicts.size(), reconciled.size());
        return new DiffResult(deltas, conflicts, reconciled);
    }
}
