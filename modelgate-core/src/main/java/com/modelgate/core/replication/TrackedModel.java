package com.modelgate.core.replication;

import com.modelgate.core.change.Change;
import com.modelgate.core.change.ChangeCustomizer;
import com.modelgate.core.change.ChangeTracker;
import com.modelgate.core.change.ChangeType;
import com.modelgate.core.change.CheckpointSequence;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.event.EventBus;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.spi.ModelStore;
import com.modelgate.core.spi.ReplicationPeer;
import com.modelgate.core.store.Filter;
import com.modelgate.core.store.InMemoryModelStore;
import com.modelgate.core.store.Where;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 开启变更追踪的模型
 * <p>
 * 包装一个 {@link ModelStore}：每次写入后 rectify 对应实体的变更记录，
 * 并作为本地的 {@link ReplicationPeer} 参与复制。
 * </p>
 */
@Slf4j
public class TrackedModel implements ReplicationPeer {

    @Getter
    private final ModelDefinition definition;
    @Getter
    private final ModelStore store;
    @Getter
    private final ChangeTracker tracker;
    private final ModelGateConfig config;
    private final EventBus eventBus;
    private final Executor executor;
    private final DiffEngine diffEngine = new DiffEngine();

    private volatile boolean trackingEnabled;
    private ScheduledExecutorService cleanupScheduler;

    public TrackedModel(ModelDefinition definition, ModelStore changeStore, ModelStore checkpointStore,
                        ModelGateConfig config, EventBus eventBus, Executor executor) {
        this.definition = definition;
        this.store = Objects.requireNonNull(definition.getStore(), "model " + definition.getName() + " has no store");
        this.config = config;
        this.eventBus = eventBus;
        this.executor = executor;
        this.tracker = new ChangeTracker(store, changeStore, new CheckpointSequence(checkpointStore),
                config, eventBus, executor);
    }

    /**
     * 变更记录与 checkpoint 都放在内存存储中
     */
    public static TrackedModel inMemory(ModelDefinition definition, ModelGateConfig config,
                                        EventBus eventBus, Executor executor) {
        return new TrackedModel(definition,
                new InMemoryModelStore(definition.getName() + "-Change"),
                new InMemoryModelStore(definition.getName() + "-Checkpoint", "seq"),
                config, eventBus, executor);
    }

    @Override
    public String getModelName() {
        return definition.getName();
    }

    public void setChangeCustomizer(ChangeCustomizer customizer) {
        tracker.setCustomizer(customizer);
    }

    // ========== 追踪开关 ==========

    /**
     * 开启追踪：此后的写入都会 rectify；配置了清理间隔时定期 rectifyAll
     */
    public synchronized void enableChangeTracking() {
        if (trackingEnabled) {
            return;
        }
        trackingEnabled = true;
        long interval = config.getChangeCleanupIntervalMs();
        if (interval > 0) {
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "modelgate-change-cleanup-" + getModelName());
                t.setDaemon(true);
                return t;
            });
            cleanupScheduler.scheduleWithFixedDelay(this::rectifyAllChanges, interval, interval, TimeUnit.MILLISECONDS);
            log.info("Change cleanup for {} scheduled every {} ms", getModelName(), interval);
        }
    }

    public boolean isTrackingEnabled() {
        return trackingEnabled;
    }

    @PreDestroy
    public synchronized void disableChangeTracking() {
        trackingEnabled = false;
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
            cleanupScheduler = null;
        }
    }

    private void requireTracking() {
        if (!trackingEnabled) {
            throw new IllegalStateException("Change tracking is not enabled for " + getModelName());
        }
    }

    // ========== 被追踪的写入 ==========

    public Map<String, Object> create(Map<String, Object> data) {
        Map<String, Object> created = store.create(data);
        afterWrite(created.get(store.getIdName()));
        return created;
    }

    @Override
    public Map<String, Object> save(Map<String, Object> data) {
        Map<String, Object> saved = store.replaceOrCreate(data);
        afterWrite(saved.get(store.getIdName()));
        return saved;
    }

    public Map<String, Object> updateAttributes(Object id, Map<String, Object> data) {
        Map<String, Object> updated = store.updateAttributes(id, data);
        afterWrite(id);
        return updated;
    }

    public int updateAll(Where where, Map<String, Object> data) {
        List<Object> ids = findIds(where);
        int count = store.updateAll(where, data);
        afterWriteAll(ids);
        return count;
    }

    @Override
    public boolean deleteById(Object id) {
        boolean deleted = store.destroyById(id);
        if (deleted) {
            afterWrite(id);
        }
        return deleted;
    }

    public int deleteAll(Where where) {
        List<Object> ids = findIds(where);
        int count = store.destroyAll(where);
        afterWriteAll(ids);
        return count;
    }

    @Override
    public Map<String, Object> findById(Object id) {
        return store.findById(id);
    }

    public List<Map<String, Object>> find(Filter filter) {
        return store.find(filter);
    }

    private List<Object> findIds(Where where) {
        return store.find(Filter.builder().where(where).fields(List.of(store.getIdName())).build()).stream()
                .map(doc -> doc.get(store.getIdName()))
                .collect(Collectors.toList());
    }

    private void afterWrite(Object id) {
        if (trackingEnabled) {
            tracker.rectifyChange(id);
        }
    }

    private void afterWriteAll(List<Object> ids) {
        if (trackingEnabled && !ids.isEmpty()) {
            tracker.rectifyModelChanges(ids);
        }
    }

    // ========== 变更查询 ==========

    @Override
    public long checkpoint() {
        return tracker.getCheckpoints().bumpLastSeq();
    }

    @Override
    public long currentCheckpoint() {
        return tracker.getCheckpoints().current();
    }

    @Override
    public List<Change> changes(long since, Filter filter) {
        requireTracking();
        return tracker.changes(since, filter);
    }

    @Override
    public DiffResult diff(long since, List<Change> remoteChanges) {
        requireTracking();
        return diffEngine.diff(tracker, since, remoteChanges);
    }

    @Override
    public Change findLastChange(Object modelId) {
        return tracker.findLastChange(modelId);
    }

    @Override
    public Change updateLastChange(Object modelId, Map<String, Object> data) {
        return tracker.updateLastChange(modelId, data);
    }

    public Change rectifyChange(Object modelId) {
        return tracker.rectifyChange(modelId);
    }

    public void rectifyAllChanges() {
        tracker.rectifyAll();
    }

    // ========== 复制 ==========

    public ReplicationResult replicate(ReplicationPeer target, Checkpoints since, ReplicationOptions options) {
        requireTracking();
        return new ReplicationOrchestrator(config, eventBus, executor).replicate(this, target, since, options);
    }

    /**
     * 把差异物化为更新
     * <p>
     * CREATE / UPDATE 读取本端实体作为数据，实体已不存在时跳过 (下一轮会得到 DELETE)；
     * DELETE 只需要 ID。
     * </p>
     */
    @Override
    public List<Update> createUpdates(List<Delta> deltas) {
        List<Update> updates = new ArrayList<>();
        for (Delta delta : deltas) {
            Change change = delta.change();
            ChangeType type = delta.type();
            Update.UpdateBuilder update = Update.builder()
                    .type(type)
                    .change(change)
                    .id(change.getModelId());
            switch (type) {
                case CREATE, UPDATE -> {
                    Map<String, Object> inst = store.findById(change.getModelId());
                    if (inst == null) {
                        log.debug("skip {} {}:{}, instance no longer exists", type, getModelName(), change.getModelId());
                        continue;
                    }
                    updates.add(update.data(inst).build());
                }
                case DELETE -> updates.add(update.build());
                default -> log.warn("skip change {}:{} of unknown type", getModelName(), change.getModelId());
            }
        }
        return updates;
    }

    /**
     * 逐条应用更新，非原子
     * <p>
     * UPDATE / DELETE 要求更新声明的 prev 等于本端当前 revision；CREATE 要求记录不存在，
     * 记录已存在且内容相同时视为已应用。写入使用以当前内容为条件的 updateAll / destroyAll，
     * 写入期间被并发修改同样视为冲突。冲突的记录会强制 rectify。
     * </p>
     *
     * @throws ConflictException 存在冲突；其余失败以第一个为准原样抛出
     */
    @Override
    public BulkUpdateResult bulkUpdate(List<Update> updates, ReplicationOptions options) {
        List<UpdateConflict> conflicts = new ArrayList<>();
        List<RuntimeException> errors = new ArrayList<>();
        List<BulkUpdateResult.Entry> results = new ArrayList<>();

        for (List<Update> chunk : ChunkedTransfer.split(updates, config.getBulkUpdateChunkSize())) {
            for (Update update : chunk) {
                if (update == null || update.getId() == null) {
                    log.debug("skip update without id");
                    continue;
                }
                try {
                    BulkUpdateResult.Entry entry = applyUpdate(update, conflicts);
                    results.add(entry);
                } catch (RuntimeException e) {
                    log.debug("bulkUpdate {}:{} failed: {}", getModelName(), update.getId(), e.getMessage());
                    errors.add(e);
                    results.add(new BulkUpdateResult.Entry(update.getId(), actionOf(update), false));
                }
            }
        }

        if (!conflicts.isEmpty()) {
            ConflictException ex = new ConflictException(conflicts);
            errors.forEach(ex::addSuppressed);
            throw ex;
        }
        if (!errors.isEmpty()) {
            RuntimeException first = errors.get(0);
            errors.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
        int count = (int) results.stream().filter(BulkUpdateResult.Entry::success).count();
        log.debug("bulkUpdate {} applied {} of {} updates", getModelName(), count, updates.size());
        return new BulkUpdateResult(count, results);
    }

    private BulkUpdateResult.Entry applyUpdate(Update update, List<UpdateConflict> conflicts) {
        Object id = update.getId();
        ChangeType type = update.getType() != null ? update.getType() : update.getChange().type();
        Change change = update.getChange();
        Map<String, Object> current = store.findById(id);
        String actualRev = current == null ? null : tracker.getHasher().revisionFor(current);
        String expectedRev = change == null ? null : change.getPrev();
        String sourceRev = change == null ? null : change.getRev();

        switch (type) {
            case CREATE -> {
                if (current != null) {
                    if (Objects.equals(actualRev, sourceRev)) {
                        return new BulkUpdateResult.Entry(id, BulkUpdateResult.Action.SKIP, true);
                    }
                    return conflict(conflicts, id, type, expectedRev, actualRev, "record already exists");
                }
                store.create(withId(update.getData(), id));
                afterWrite(id);
                return new BulkUpdateResult.Entry(id, BulkUpdateResult.Action.CREATE, true);
            }
            case UPDATE -> {
                if (current == null) {
                    return conflict(conflicts, id, type, expectedRev, null, "record does not exist");
                }
                if (!Objects.equals(expectedRev, actualRev)) {
                    if (Objects.equals(actualRev, sourceRev)) {
                        return new BulkUpdateResult.Entry(id, BulkUpdateResult.Action.SKIP, true);
                    }
                    return conflict(conflicts, id, type, expectedRev, actualRev, "revision mismatch");
                }
                int count = store.updateAll(whereUnchanged(current), fillMissing(withId(update.getData(), id), current));
                if (count == 0) {
                    return conflict(conflicts, id, type, expectedRev, actualRev, "record changed during update");
                }
                afterWrite(id);
                return new BulkUpdateResult.Entry(id, BulkUpdateResult.Action.UPDATE, true);
            }
            case DELETE -> {
                if (current == null) {
                    return conflict(conflicts, id, type, expectedRev, null, "record does not exist");
                }
                if (!Objects.equals(expectedRev, actualRev)) {
                    return conflict(conflicts, id, type, expectedRev, actualRev, "revision mismatch");
                }
                int count = store.destroyAll(whereUnchanged(current));
                if (count == 0) {
                    return conflict(conflicts, id, type, expectedRev, actualRev, "record changed during delete");
                }
                afterWrite(id);
                return new BulkUpdateResult.Entry(id, BulkUpdateResult.Action.DELETE, true);
            }
            default -> throw new IllegalArgumentException("Unsupported update type " + type + " for id " + id);
        }
    }

    private BulkUpdateResult.Entry conflict(List<UpdateConflict> conflicts, Object id, ChangeType type,
                                            String expectedRev, String actualRev, String reason) {
        log.debug("conflict on {}:{} - {}", getModelName(), id, reason);
        conflicts.add(new UpdateConflict(id, type, expectedRev, actualRev, reason));
        // 本端变更记录对齐到实际状态，供下一轮 diff 使用
        tracker.rectifyChange(id);
        return new BulkUpdateResult.Entry(id, actionOf(type), false);
    }

    private Where whereUnchanged(Map<String, Object> current) {
        Where where = Where.create();
        current.forEach(where::andEq);
        return where;
    }

    private Map<String, Object> withId(Map<String, Object> data, Object id) {
        Map<String, Object> copy = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        copy.put(store.getIdName(), id);
        return copy;
    }

    /**
     * 源端没有的字段置为 null，写入后 revision 与源端一致
     */
    private static Map<String, Object> fillMissing(Map<String, Object> data, Map<String, Object> current) {
        for (String key : current.keySet()) {
            data.putIfAbsent(key, null);
        }
        return data;
    }

    private static BulkUpdateResult.Action actionOf(Update update) {
        return update.getType() == null ? BulkUpdateResult.Action.SKIP : actionOf(update.getType());
    }

    private static BulkUpdateResult.Action actionOf(ChangeType type) {
        return switch (type) {
            case CREATE -> BulkUpdateResult.Action.CREATE;
            case UPDATE -> BulkUpdateResult.Action.UPDATE;
            case DELETE -> BulkUpdateResult.Action.DELETE;
            default -> BulkUpdateResult.Action.SKIP;
        };
    }
}
