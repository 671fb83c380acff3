package com.modelgate.core.replication;

import com.modelgate.core.change.Change;
import com.modelgate.core.change.Conflict;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.event.ConflictsDetectedEvent;
import com.modelgate.core.event.EventBus;
import com.modelgate.core.spi.ReplicationPeer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 单向复制 source -> target
 * <p>
 * 每一轮：推进两端 checkpoint，分块下载源端变更，分块上传到目标端求差异，
 * 把 SOURCE 差异物化为更新并 bulkUpdate 到目标端。
 * 一轮有更新且无冲突时以新的 checkpoint 再来一轮，最多 maxReplicationAttempts 轮，
 * 用来追上复制期间源端新产生的变更。
 * </p>
 */
@Slf4j
public class ReplicationOrchestrator {

    private final ModelGateConfig config;
    private final EventBus eventBus;
    private final Executor executor;

    public ReplicationOrchestrator(ModelGateConfig config, EventBus eventBus, Executor executor) {
        this.config = config;
        this.eventBus = eventBus;
        this.executor = executor;
    }

    public ReplicationResult replicate(ReplicationPeer source, ReplicationPeer target,
                                       Checkpoints since, ReplicationOptions options) {
        ReplicationOptions opts = options == null ? ReplicationOptions.defaults() : options;
        Checkpoints from = since == null ? Checkpoints.fromStart() : since;
        int maxAttempts = Math.max(1, config.getMaxReplicationAttempts());

        ReplicationResult result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result = tryReplicate(source, target, from, opts);
            if (result.hasConflicts() || result.getUpdates().isEmpty()) {
                break;
            }
            log.debug("replication {} -> {} attempt {} applied {} updates, running again",
                    source.getModelName(), target.getModelName(), attempt, result.getUpdates().size());
            from = result.getCheckpoints();
        }
        log.info("Replicated {} -> {}: {} updates, {} conflicts, checkpoints {}",
                source.getModelName(), target.getModelName(),
                result.getUpdates().size(), result.getConflicts().size(), result.getCheckpoints());
        return result;
    }

    ReplicationResult tryReplicate(ReplicationPeer source, ReplicationPeer target,
                                   Checkpoints since, ReplicationOptions options) {
        int chunkSize = config.getReplicationChunkSize();

        Checkpoints newCheckpoints = new Checkpoints(source.checkpoint(), target.checkpoint());

        List<Change> sourceChanges = ChunkedTransfer.download(options.getFilter(), chunkSize,
                page -> source.changes(since.source(), page));

        ChunkAccumulator<DiffResult> diffs = ChunkedTransfer.upload(sourceChanges, chunkSize,
                chunk -> target.diff(since.target(), chunk));
        diffs.throwIfFailed();
        DiffResult diff = DiffResult.merge(diffs.getResults());

        ChunkAccumulator<List<Update>> materialized = ChunkedTransfer.upload(diff.sourceDeltas(), chunkSize,
                source::createUpdates);
        materialized.throwIfFailed();
        List<Update> updates = materialized.getResults().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());

        Map<String, Conflict> conflicts = new LinkedHashMap<>();
        for (Change change : diff.conflicts()) {
            conflicts.putIfAbsent(key(change.getModelId()), new Conflict(change.getModelId(), source, target, executor));
        }

        List<Update> applied = updates;
        if (!updates.isEmpty()) {
            try {
                target.bulkUpdate(updates, options);
            } catch (ConflictException e) {
                Set<String> rejected = new HashSet<>();
                for (UpdateConflict uc : e.getConflicts()) {
                    rejected.add(key(uc.modelId()));
                    conflicts.putIfAbsent(key(uc.modelId()), new Conflict(uc.modelId(), source, target, executor));
                }
                applied = updates.stream()
                        .filter(u -> !rejected.contains(key(u.getId())))
                        .collect(Collectors.toList());
            }
        }

        List<Conflict> conflictList = new ArrayList<>(conflicts.values());
        if (!conflictList.isEmpty()) {
            log.warn("Replication {} -> {} found {} conflict(s)",
                    source.getModelName(), target.getModelName(), conflictList.size());
            if (eventBus != null) {
                eventBus.publish(new ConflictsDetectedEvent(source.getModelName(), target.getModelName(), conflictList));
            }
        }

        return ReplicationResult.builder()
                .conflicts(conflictList)
                .checkpoints(newCheckpoints)
                .updates(applied)
                .targetDeltas(diff.targetDeltas())
                .build();
    }

    private static String key(Object modelId) {
        return String.valueOf(modelId);
    }
}
