package com.modelgate.core.change;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 变更记录
 * <p>
 * 每个被追踪的实体一条，id = hash(modelName + "-" + modelId)。
 * rev 为实体当前状态的 revision (已删除时为 null)，prev 为上一个 checkpoint 边界时的 rev。
 * 类型不存储，始终由 (rev, prev) 推导。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Change {

    /**
     * prev 无法确定时的哨兵值，带此值的记录会被删除
     */
    public static final String UNKNOWN = "unknown";

    private static final Set<String> FIELDS = Set.of("id", "modelName", "modelId", "rev", "prev", "checkpoint");

    private String id;
    private String modelName;
    private Object modelId;
    private String rev;
    private String prev;
    private long checkpoint;

    /**
     * 由 {@link ChangeCustomizer} 填充的附加字段，与固定字段一起存储
     */
    @Builder.Default
    private Map<String, Object> customProperties = new LinkedHashMap<>();

    public ChangeType type() {
        return ChangeType.of(rev, prev);
    }

    /**
     * rev 是否相同 (都为 null 也视为相同)
     */
    public boolean sameRevision(Change other) {
        return other != null && Objects.equals(rev, other.rev);
    }

    /**
     * 本变更是否基于给定变更 (prev 等于对方的 rev)
     */
    public boolean isBasedOn(Change other) {
        return other != null && prev != null && prev.equals(other.rev);
    }

    /**
     * 冲突判定，对称：
     * <ul>
     *     <li>rev 相同不冲突</li>
     *     <li>两个删除不冲突，删除与其他任何类型都冲突</li>
     *     <li>UPDATE / UPDATE 与 CREATE / UPDATE：一方基于另一方时不冲突</li>
     *     <li>其余 (包括 rev 不同的 CREATE / CREATE) 冲突</li>
     * </ul>
     */
    public boolean conflictsWith(Change other) {
        if (other == null) {
            return false;
        }
        if (sameRevision(other)) {
            return false;
        }
        if (bothDeleted(this, other)) {
            return false;
        }
        ChangeType thisType = type();
        ChangeType thatType = other.type();
        if (thisType == ChangeType.DELETE || thatType == ChangeType.DELETE) {
            return true;
        }
        boolean updatePair = (thisType == ChangeType.UPDATE && (thatType == ChangeType.UPDATE || thatType == ChangeType.CREATE))
                || (thatType == ChangeType.UPDATE && thisType == ChangeType.CREATE);
        if (updatePair) {
            return !isBasedOn(other) && !other.isBasedOn(this);
        }
        return true;
    }

    /**
     * 两端都已删除
     */
    public static boolean bothDeleted(Change a, Change b) {
        return a.type() == ChangeType.DELETE && b.type() == ChangeType.DELETE;
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (customProperties != null) {
            data.putAll(customProperties);
        }
        data.put("id", id);
        data.put("modelName", modelName);
        data.put("modelId", modelId);
        data.put("rev", rev);
        data.put("prev", prev);
        data.put("checkpoint", checkpoint);
        return data;
    }

    public static Change fromData(Map<String, Object> data) {
        Map<String, Object> custom = new LinkedHashMap<>();
        data.forEach((k, v) -> {
            if (!FIELDS.contains(k)) {
                custom.put(k, v);
            }
        });
        Object checkpoint = data.get("checkpoint");
        return Change.builder()
                .id((String) data.get("id"))
                .modelName((String) data.get("modelName"))
                .modelId(data.get("modelId"))
                .rev((String) data.get("rev"))
                .prev((String) data.get("prev"))
                .checkpoint(checkpoint instanceof Number n ? n.longValue() : 0L)
                .customProperties(custom)
                .build();
    }
}
