package com.modelgate.core.change;

/**
 * 变更类型，完全由 (rev, prev) 推导
 * <pre>
 * (有, 有) -> UPDATE
 * (有, 无) -> CREATE
 * (无, 有) -> DELETE
 * (无, 无) -> UNKNOWN
 * </pre>
 */
public enum ChangeType {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    UNKNOWN("unknown");

    private final String value;

    ChangeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ChangeType of(String rev, String prev) {
        boolean hasRev = rev != null && !rev.isEmpty();
        boolean hasPrev = prev != null && !prev.isEmpty();
        if (hasRev && hasPrev) {
            return UPDATE;
        }
        if (hasRev) {
            return CREATE;
        }
        if (hasPrev) {
            return DELETE;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
