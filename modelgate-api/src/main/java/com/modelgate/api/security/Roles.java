package com.modelgate.api.security;

/**
 * 内置角色常量
 * <p>
 * 强弱顺序: $owner > $related > $authenticated / $unauthenticated > $everyone，
 * 未识别的（自定义）角色比所有内置角色都强。
 * </p>
 */
public final class Roles {

    /**
     * 资源的拥有者
     */
    public static final String OWNER = "$owner";

    /**
     * 与资源存在关联关系的用户
     */
    public static final String RELATED = "$related";

    /**
     * 已认证用户
     */
    public static final String AUTHENTICATED = "$authenticated";

    /**
     * 未认证用户
     */
    public static final String UNAUTHENTICATED = "$unauthenticated";

    /**
     * 所有人
     */
    public static final String EVERYONE = "$everyone";

    private static final int CUSTOM_ROLE_STRENGTH = 5;

    private Roles() {
    }

    /**
     * 角色强度，自定义角色为 5
     */
    public static int strength(String role) {
        if (role == null) {
            return CUSTOM_ROLE_STRENGTH;
        }
        switch (role) {
            case OWNER:
                return 4;
            case RELATED:
                return 3;
            case AUTHENTICATED:
            case UNAUTHENTICATED:
                return 2;
            case EVERYONE:
                return 1;
            default:
                return CUSTOM_ROLE_STRENGTH;
        }
    }

    /**
     * role1 是否严格强于 role2
     */
    public static boolean isStronger(String role1, String role2) {
        return strength(role1) > strength(role2);
    }
}
