package com.modelgate.core.change;

import com.modelgate.api.exception.NotFoundException;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.event.ChangeErrorEvent;
import com.modelgate.core.event.EventBus;
import com.modelgate.core.spi.ModelStore;
import com.modelgate.core.store.Filter;
import com.modelgate.core.store.Where;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 一个被追踪模型的变更集合
 * <p>
 * 职责：维护每个实体的 Change 记录，在实体写入后 rectify，
 * 按 checkpoint 查询变更，为复制提供最近一次变更。
 * </p>
 */
@Slf4j
public class ChangeTracker {

    @Getter
    private final String modelName;
    private final ModelStore trackedStore;
    private final ModelStore changeStore;
    @Getter
    private final CheckpointSequence checkpoints;
    @Getter
    private final RevisionHasher hasher;
    private final Executor executor;
    private final EventBus eventBus;
    private final boolean ignoreErrors;

    private volatile ChangeCustomizer customizer;

    public ChangeTracker(ModelStore trackedStore, ModelStore changeStore, CheckpointSequence checkpoints,
                         ModelGateConfig config, EventBus eventBus, Executor executor) {
        this.modelName = trackedStore.getModelName();
        this.trackedStore = trackedStore;
        this.changeStore = changeStore;
        this.checkpoints = checkpoints;
        this.hasher = new RevisionHasher(config.getHashAlgorithm());
        this.ignoreErrors = config.isIgnoreChangeErrors();
        this.eventBus = eventBus;
        this.executor = executor;
    }

    public void setCustomizer(ChangeCustomizer customizer) {
        this.customizer = customizer;
    }

    public String idForModel(Object modelId) {
        return hasher.hash(modelName + "-" + modelId);
    }

    public Change findOrCreateChange(Object modelId) {
        String id = idForModel(modelId);
        Map<String, Object> existing = changeStore.findById(id);
        if (existing != null) {
            log.debug("found existing change for {}:{}", modelName, modelId);
            return Change.fromData(existing);
        }
        long checkpoint = checkpoints.current();
        Change change = Change.builder()
                .id(id)
                .modelName(modelName)
                .modelId(modelId)
                .checkpoint(checkpoint)
                .build();
        log.debug("creating change for {}:{} at checkpoint {}", modelName, modelId, checkpoint);
        return Change.fromData(changeStore.replaceOrCreate(change.toData()));
    }

    /**
     * 按实体当前状态修正变更记录
     * <p>
     * 实体未变化 (rev 相同) 时不做任何写入。只有跨越 checkpoint 时才把旧 rev 移入 prev；
     * 删除时若找不到旧 rev 且没有 prev，prev 记为 {@link Change#UNKNOWN} 并删除该记录；
     * 同一 checkpoint 内既无 rev 也无 prev 的记录同样删除。
     * checkpoint 最后更新。
     * </p>
     *
     * @return 修正后的记录，记录被删除时返回 null
     */
    public Change rectify(Change change) {
        try {
            return doRectify(change);
        } catch (RuntimeException e) {
            log.debug("Error in rectify {}:{}: {}", modelName, change.getModelId(), e.getMessage());
            if (eventBus != null) {
                try {
                    eventBus.publish(new ChangeErrorEvent(modelName, change.getModelId(), e));
                } catch (RuntimeException listenerError) {
                    log.warn("ChangeErrorEvent listener failed for {}:{}", modelName, change.getModelId(), listenerError);
                    e.addSuppressed(listenerError);
                }
            }
            if (!ignoreErrors) {
                throw e;
            }
            log.warn("Ignoring rectify error for {}:{}", modelName, change.getModelId(), e);
            return change;
        }
    }

    private Change doRectify(Change change) {
        String currentRev = change.getRev();
        Map<String, Object> inst = trackedStore.findById(change.getModelId());

        String newRev = null;
        if (inst != null) {
            newRev = hasher.revisionFor(inst);
            if (newRev.equals(currentRev)) {
                log.debug("rev unchanged for {}:{}, nothing to rectify", modelName, change.getModelId());
                return change;
            }
            ChangeCustomizer c = customizer;
            if (c != null) {
                c.fillCustomChangeProperties(inst, change);
            }
        }

        long checkpoint = checkpoints.current();
        boolean crossing = change.getCheckpoint() != checkpoint;

        if (newRev != null) {
            change.setRev(newRev);
            if (crossing && currentRev != null) {
                change.setPrev(currentRev);
            }
        } else {
            change.setRev(null);
            if (crossing) {
                if (currentRev != null) {
                    change.setPrev(currentRev);
                } else if (change.getPrev() == null) {
                    log.warn("Could not determine prev for {}:{}", modelName, change.getModelId());
                    change.setPrev(Change.UNKNOWN);
                }
            }
        }

        if (crossing) {
            change.setCheckpoint(checkpoint);
        }

        if (Change.UNKNOWN.equals(change.getPrev())) {
            changeStore.destroyById(change.getId());
            log.debug("removed change {}:{} with unknown prev", modelName, change.getModelId());
            return null;
        }
        // 创建后在首次 rectify 前就被删除，没有可复制的状态
        if (change.getRev() == null && change.getPrev() == null) {
            changeStore.destroyById(change.getId());
            log.debug("removed change {}:{} that was never revised", modelName, change.getModelId());
            return null;
        }

        changeStore.replaceOrCreate(change.toData());
        return change;
    }

    public Change rectifyChange(Object modelId) {
        return rectify(findOrCreateChange(modelId));
    }

    /**
     * 并发 rectify 多个实体，全部完成后聚合失败
     */
    public void rectifyModelChanges(List<?> modelIds) {
        Map<Object, Throwable> errors = new LinkedHashMap<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (Object id : modelIds) {
            tasks.add(CompletableFuture.runAsync(() -> rectifyChange(id), executor)
                    .whenComplete((v, e) -> {
                        if (e != null) {
                            synchronized (errors) {
                                errors.put(id, e.getCause() != null ? e.getCause() : e);
                            }
                        }
                    }));
        }
        for (CompletableFuture<Void> task : tasks) {
            task.exceptionally(e -> null).join();
        }
        if (!errors.isEmpty()) {
            String desc = errors.entrySet().stream()
                    .map(e -> "#" + e.getKey() + " - " + e.getValue())
                    .collect(Collectors.joining("\n"));
            throw new ChangeTrackingException("Cannot rectify " + modelName + " changes:\n" + desc, errors);
        }
    }

    /**
     * 顺序修正全部变更记录，单条失败只记录日志
     */
    public void rectifyAll() {
        List<Map<String, Object>> all = changeStore.find(Filter.where(Where.eq("modelName", modelName)));
        log.debug("rectifyAll found {} changes for {}", all.size(), modelName);
        for (Map<String, Object> doc : all) {
            Change change = Change.fromData(doc);
            try {
                rectify(change);
            } catch (RuntimeException e) {
                log.warn("Error rectifying change {}:{} - {}", modelName, change.getModelId(), e.getMessage());
            }
        }
    }

    public String currentRevision(Change change) {
        Map<String, Object> inst = trackedStore.findById(change.getModelId());
        return inst == null ? null : hasher.revisionFor(inst);
    }

    /**
     * 变更记录的查询条件；实体 filter 不作用于变更记录，而在 {@link #changes} 中作用于实体
     */
    public Filter createChangeFilter(long since) {
        Where where = Where.create()
                .and("checkpoint", Where.Op.GTE, since)
                .andEq("modelName", modelName);
        return Filter.where(where);
    }

    /**
     * checkpoint 不小于 since 的变更
     * <p>
     * DELETE 变更总是保留；其余变更只在实体仍存在且满足 filter 时保留。
     * filter 的 skip / limit 作用于过滤后的结果，分页下载因此不会因过滤而提前结束。
     * </p>
     */
    public List<Change> changes(long since, Filter filter) {
        List<Change> changes = changeStore.find(createChangeFilter(since)).stream()
                .map(Change::fromData)
                .collect(Collectors.toList());
        if (changes.isEmpty()) {
            return changes;
        }

        List<Object> ids = changes.stream().map(Change::getModelId).collect(Collectors.toList());
        Where modelWhere = Where.inq(trackedStore.getIdName(), ids);
        if (filter != null && filter.getWhere() != null) {
            modelWhere.merge(filter.getWhere());
        }
        Set<String> existing = new HashSet<>();
        for (Map<String, Object> inst : trackedStore.find(Filter.builder()
                .where(modelWhere)
                .fields(List.of(trackedStore.getIdName()))
                .build())) {
            existing.add(String.valueOf(inst.get(trackedStore.getIdName())));
        }

        List<Change> result = new ArrayList<>();
        for (Change change : changes) {
            if (change.type() == ChangeType.DELETE || existing.contains(String.valueOf(change.getModelId()))) {
                result.add(change);
            }
        }
        log.debug("Returning {} of {} changes for {} since {}", result.size(), changes.size(), modelName, since);
        return page(result, filter);
    }

    private static List<Change> page(List<Change> changes, Filter filter) {
        if (filter == null || (filter.getSkip() == null && filter.getLimit() == null)) {
            return changes;
        }
        int from = Math.min(filter.getSkip() == null ? 0 : filter.getSkip(), changes.size());
        int to = filter.getLimit() == null ? changes.size() : Math.min(from + filter.getLimit(), changes.size());
        return new ArrayList<>(changes.subList(from, to));
    }

    public Change findLastChange(Object modelId) {
        Map<String, Object> doc = changeStore.findById(idForModel(modelId));
        return doc == null ? null : Change.fromData(doc);
    }

    /**
     * @throws NotFoundException 变更记录不存在
     */
    public Change updateLastChange(Object modelId, Map<String, Object> data) {
        String id = idForModel(modelId);
        if (changeStore.findById(id) == null) {
            throw new NotFoundException("No change record found for " + modelName + " with id " + modelId);
        }
        Map<String, Object> patch = new LinkedHashMap<>(data);
        patch.remove("id");
        return Change.fromData(changeStore.updateAttributes(id, patch));
    }

    public List<Change> findAll() {
        return changeStore.find(Filter.where(Where.eq("modelName", modelName))).stream()
                .map(Change::fromData)
                .collect(Collectors.toList());
    }
}
