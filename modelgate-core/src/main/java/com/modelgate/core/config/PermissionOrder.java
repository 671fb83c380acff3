package com.modelgate.core.config;

import com.modelgate.api.security.Permission;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 权限全序
 * <p>
 * 只用于规则打分的最后一级平局裁决，不影响规则是否匹配。
 * 序号从 0 开始，排在越后面的权限在完全相同的规则之间越优先。
 * </p>
 */
public final class PermissionOrder {

    private static final PermissionOrder DEFAULT = new PermissionOrder(List.of(
            Permission.DEFAULT, Permission.ALLOW, Permission.ALARM, Permission.AUDIT, Permission.DENY));

    private final Map<Permission, Integer> ranks = new EnumMap<>(Permission.class);
    private final List<Permission> order;

    private PermissionOrder(List<Permission> order) {
        if (order == null || order.size() != Permission.values().length) {
            throw new IllegalArgumentException("Permission order must list every permission exactly once: " + order);
        }
        for (int i = 0; i < order.size(); i++) {
            Permission p = order.get(i);
            if (p == null || ranks.put(p, i) != null) {
                throw new IllegalArgumentException("Permission order must list every permission exactly once: " + order);
            }
        }
        this.order = Collections.unmodifiableList(order);
    }

    public static PermissionOrder defaults() {
        return DEFAULT;
    }

    public static PermissionOrder of(Permission... order) {
        return new PermissionOrder(Arrays.asList(order));
    }

    /**
     * 从名称列表解析，用于 YAML / Spring 配置
     */
    public static PermissionOrder parse(List<String> names) {
        if (names == null || names.isEmpty()) {
            return DEFAULT;
        }
        return new PermissionOrder(names.stream().map(n -> Permission.valueOf(n.trim().toUpperCase())).collect(Collectors.toList()));
    }

    public int rank(Permission permission) {
        return ranks.get(permission == null ? Permission.DEFAULT : permission);
    }

    public List<Permission> asList() {
        return order;
    }

    @Override
    public String toString() {
        return order.toString();
    }
}
