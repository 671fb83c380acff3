package com.modelgate.api.security;

/**
 * 权限取值
 *
 * @author ModelGate
 */
public enum Permission {
    /**
     * 未指定，最终会按模型的默认权限落定为具体值
     */
    DEFAULT,
    /**
     * 显式允许
     */
    ALLOW,
    /**
     * 允许，但需要以系统约定的方式告警
     */
    ALARM,
    /**
     * 允许，但需要记录审计
     */
    AUDIT,
    /**
     * 显式拒绝
     */
    DENY;

    public static Permission of(String value) {
        if (value == null || value.isEmpty()) {
            return DEFAULT;
        }
        return Permission.valueOf(value.toUpperCase());
    }
}
