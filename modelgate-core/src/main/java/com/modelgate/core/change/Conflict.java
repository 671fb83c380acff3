package com.modelgate.core.change;

import com.modelgate.core.spi.ReplicationPeer;
import com.modelgate.core.util.Futures;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 一次复制中检测到的冲突
 * <p>
 * 同一个 modelId 在源端与目标端自上次复制以来都被修改且互不基于对方。
 * 解决方式都是修改源端，使下一次复制能够无冲突地完成。
 * </p>
 */
@Slf4j
@Getter
public class Conflict {

    private final Object modelId;
    private final ReplicationPeer source;
    private final ReplicationPeer target;
    private final Executor executor;

    /**
     * 一对取值
     */
    public record Sides<T>(T source, T target) {
    }

    public Conflict(Object modelId, ReplicationPeer source, ReplicationPeer target, Executor executor) {
        this.modelId = modelId;
        this.source = source;
        this.target = target;
        this.executor = executor;
    }

    /**
     * 并发读取两端的实体，不存在的一端为 null
     */
    public Sides<Map<String, Object>> models() {
        CompletableFuture<Map<String, Object>> s = CompletableFuture.supplyAsync(() -> source.findById(modelId), executor);
        CompletableFuture<Map<String, Object>> t = CompletableFuture.supplyAsync(() -> target.findById(modelId), executor);
        return new Sides<>(Futures.join(s), Futures.join(t));
    }

    /**
     * 并发读取两端的最近一次变更
     */
    public Sides<Change> changes() {
        CompletableFuture<Change> s = CompletableFuture.supplyAsync(() -> source.findLastChange(modelId), executor);
        CompletableFuture<Change> t = CompletableFuture.supplyAsync(() -> target.findLastChange(modelId), executor);
        return new Sides<>(Futures.join(s), Futures.join(t));
    }

    /**
     * 把源端变更标记为基于目标端当前 rev，下一次复制时源端覆盖目标端
     */
    public void resolve() {
        Change targetChange = target.findLastChange(modelId);
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("prev", targetChange == null ? null : targetChange.getRev());
        source.updateLastChange(modelId, patch);
        log.debug("resolved conflict {}:{} with prev {}", source.getModelName(), modelId, patch.get("prev"));
    }

    public void resolveUsingSource() {
        resolve();
    }

    /**
     * 用目标端状态覆盖源端；目标端已删除时删除源端
     */
    public void resolveUsingTarget() {
        Map<String, Object> targetModel = target.findById(modelId);
        if (targetModel == null) {
            source.deleteById(modelId);
            return;
        }
        source.save(targetModel);
    }

    /**
     * 以给定数据作为合并结果
     *
     * @param data 合并后的属性，null 表示删除
     */
    public void resolveManually(Map<String, Object> data) {
        if (data == null) {
            source.deleteById(modelId);
        } else {
            Sides<Map<String, Object>> models = models();
            Map<String, Object> base = models.source() != null ? models.source() : models.target();
            Map<String, Object> merged = base == null ? new LinkedHashMap<>() : new LinkedHashMap<>(base);
            merged.putAll(data);
            source.save(merged);
        }
        resolve();
    }

    /**
     * 交换两端，用于反向复制时复用冲突
     */
    public Conflict swapParties() {
        return new Conflict(modelId, target, source, executor);
    }

    /**
     * 两端都是 UPDATE 时为 UPDATE；任一端为 DELETE 时为 DELETE；其余 UNKNOWN
     */
    public ChangeType type() {
        Sides<Change> changes = changes();
        ChangeType sourceType = changes.source() == null ? ChangeType.UNKNOWN : changes.source().type();
        ChangeType targetType = changes.target() == null ? ChangeType.UNKNOWN : changes.target().type();
        if (sourceType == ChangeType.UPDATE && targetType == ChangeType.UPDATE) {
            return ChangeType.UPDATE;
        }
        if (sourceType == ChangeType.DELETE || targetType == ChangeType.DELETE) {
            return ChangeType.DELETE;
        }
        return ChangeType.UNKNOWN;
    }

    @Override
    public String toString() {
        return "Conflict{" + source.getModelName() + " -> " + target.getModelName() + ", modelId=" + modelId + "}";
    }
}
