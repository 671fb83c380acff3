package com.modelgate.api.security;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 访问请求
 * <p>
 * 一次解析过程中不可变；落定默认权限、替换权限都会返回新实例。
 * </p>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class AccessRequest {

    private final String model;
    private final String property;
    private final AccessType accessType;

    @Builder.Default
    private final Permission permission = Permission.DEFAULT;

    /**
     * 方法名及其别名，用于 property 匹配
     */
    @Builder.Default
    private final List<String> methodNames = Collections.emptyList();

    public static AccessRequest of(String model, String property, AccessType accessType) {
        return AccessRequest.builder()
                .model(model)
                .property(property)
                .accessType(accessType)
                .build();
    }

    public String getModelOrAll() {
        return model == null ? AclRule.ALL : model;
    }

    public String getPropertyOrAll() {
        return property == null ? AclRule.ALL : property;
    }

    public AccessType getAccessTypeOrAll() {
        return accessType == null ? AccessType.ALL : accessType;
    }

    /**
     * model / property / accessType 任意一项为通配
     */
    public boolean isWildcard() {
        return AclRule.ALL.equals(getModelOrAll())
                || AclRule.ALL.equals(getPropertyOrAll())
                || getAccessTypeOrAll() == AccessType.ALL;
    }

    public AccessRequest withPermission(Permission permission) {
        return toBuilder().permission(permission).build();
    }

    public AccessRequest withAccessType(AccessType accessType) {
        return toBuilder().accessType(accessType).build();
    }

    /**
     * 将 DEFAULT 落定为具体权限，非 DEFAULT 时原样返回
     *
     * @param defaultPermission 模型或全局配置的默认权限，null 时按 ALLOW
     */
    public AccessRequest settleDefaultPermission(Permission defaultPermission) {
        if (permission != Permission.DEFAULT) {
            return this;
        }
        Permission settled = defaultPermission == null || defaultPermission == Permission.DEFAULT
                ? Permission.ALLOW : defaultPermission;
        return withPermission(settled);
    }

    public boolean isAllowed() {
        return permission != Permission.DENY;
    }
}
