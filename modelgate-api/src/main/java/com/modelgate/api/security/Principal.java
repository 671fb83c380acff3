package com.modelgate.api.security;

import java.util.Objects;

/**
 * 主体 (用户 / 应用 / 角色 / 授权范围)
 * <p>
 * type 除内置常量外，也可以是自定义用户模型的名称。
 * </p>
 *
 * @param type 主体类型
 * @param id   主体 ID
 */
public record Principal(String type, Object id) {

    public static final String USER = "USER";
    public static final String APPLICATION = "APP";
    public static final String ROLE = "ROLE";
    public static final String SCOPE = "SCOPE";

    public Principal {
        Objects.requireNonNull(type, "type");
    }

    public static Principal user(Object id) {
        return new Principal(USER, id);
    }

    public static Principal app(Object id) {
        return new Principal(APPLICATION, id);
    }

    public static Principal role(String name) {
        return new Principal(ROLE, name);
    }

    /**
     * ID 以字符串形式比较
     */
    public boolean matches(String otherType, Object otherId) {
        return type.equals(otherType) && id != null && otherId != null
                && String.valueOf(id).equals(String.valueOf(otherId));
    }

    /**
     * 是否为内置类型之外的主体 (自定义用户模型)
     */
    public boolean isCustomType() {
        return !USER.equals(type) && !APPLICATION.equals(type) && !ROLE.equals(type) && !SCOPE.equals(type);
    }
}
