package com.modelgate.core.replication;

import com.modelgate.core.change.Change;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 差异结果
 *
 * @param deltas     需要处理的差异
 * @param conflicts  与目标端冲突的源端变更
 * @param reconciled 两端 revision 一致或已对齐的 modelId
 */
public record DiffResult(List<Delta> deltas, List<Change> conflicts, List<Object> reconciled) {

    public static DiffResult empty() {
        return new DiffResult(List.of(), List.of(), List.of());
    }

    public List<Delta> sourceDeltas() {
        return deltas.stream().filter(d -> d.origin() == Delta.Origin.SOURCE).collect(Collectors.toList());
    }

    public List<Delta> targetDeltas() {
        return deltas.stream().filter(d -> d.origin() == Delta.Origin.TARGET).collect(Collectors.toList());
    }

    /**
     * 合并分块上传得到的多个结果
     * <p>
     * 每个分块都会看到全部目标端变更，所以某分块中"仅目标端"的差异可能在另一分块中已配对。
     * 合并时 TARGET 差异按 modelId 去重，并丢弃在任何分块中已配对 (SOURCE 差异、冲突、已对齐) 的 modelId。
     * </p>
     */
    public static DiffResult merge(List<DiffResult> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<Delta> sourceDeltas = new ArrayList<>();
        List<Change> conflicts = new ArrayList<>();
        List<Object> reconciled = new ArrayList<>();
        Set<String> paired = new HashSet<>();
        for (DiffResult part : parts) {
            for (Delta d : part.sourceDeltas()) {
                sourceDeltas.add(d);
                paired.add(key(d.modelId()));
            }
            for (Change c : part.conflicts()) {
                conflicts.add(c);
                paired.add(key(c.getModelId()));
            }
            for (Object id : part.reconciled()) {
                reconciled.add(id);
                paired.add(key(id));
            }
        }

        Map<String, Delta> targetDeltas = new LinkedHashMap<>();
        for (DiffResult part : parts) {
            for (Delta d : part.targetDeltas()) {
                String k = key(d.modelId());
                if (!paired.contains(k)) {
                    targetDeltas.putIfAbsent(k, d);
                }
            }
        }

        List<Delta> deltas = new ArrayList<>(sourceDeltas);
        deltas.addAll(targetDeltas.values());
        return new DiffResult(deltas, conflicts, reconciled);
    }

    static String key(Object modelId) {
        return String.valueOf(modelId);
    }
}
