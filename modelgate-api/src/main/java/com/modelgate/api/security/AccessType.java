package com.modelgate.api.security;

/**
 * 访问类型枚举
 * 定义了 ACL 规则与访问请求中的操作类型。
 * <p>
 * {@link #ALL} 为通配符 {@code "*"}，规则中表示匹配任意类型，请求中表示"所有操作"。
 * </p>
 *
 * @author ModelGate
 */
public enum AccessType {
    READ("READ"),
    WRITE("WRITE"),
    EXECUTE("EXECUTE"),
    REPLICATE("REPLICATE"), // 拉取变更（复制）
    ALL("*");

    private final String value;

    AccessType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 具体（非通配）的访问类型，通配请求按此顺序逐个解析
     */
    public static AccessType[] specificTypes() {
        return new AccessType[]{READ, WRITE, EXECUTE};
    }

    /**
     * 按字面值解析，null 或空串视为通配
     */
    public static AccessType of(String value) {
        if (value == null || value.isEmpty() || "*".equals(value)) {
            return ALL;
        }
        for (AccessType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown access type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
