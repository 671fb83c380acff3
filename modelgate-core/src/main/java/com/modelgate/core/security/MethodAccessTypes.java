package com.modelgate.core.security;

import com.modelgate.api.security.AccessType;

import java.util.Set;

/**
 * 按方法名推断访问类型
 * <p>
 * 方法定义显式声明 accessType 时以声明为准，这里只处理未声明的情况。
 * </p>
 */
public final class MethodAccessTypes {

    private static final Set<String> READ_METHODS = Set.of(
            "exists", "findById", "find", "findOne", "count",
            "diff", "changes", "currentCheckpoint", "createUpdates",
            "findLastChange", "createChangeStream");

    private static final Set<String> WRITE_METHODS = Set.of(
            "create", "upsert", "updateOrCreate", "patchOrCreate", "replaceOrCreate",
            "upsertWithWhere", "patchOrCreateWithWhere", "replaceById",
            "updateAttributes", "patchAttributes",
            "destroyAll", "updateAll", "update",
            "deleteById", "destroyById", "removeById",
            "bulkUpdate", "updateLastChange", "rectifyChange", "rectifyAllChanges");

    private static final Set<String> REPLICATE_METHODS = Set.of("checkpoint");

    private MethodAccessTypes() {
    }

    public static AccessType of(String methodName) {
        if (methodName == null) {
            return AccessType.ALL;
        }
        // 原型方法以 "prototype." 前缀出现
        String name = methodName.startsWith("prototype.") ? methodName.substring("prototype.".length()) : methodName;
        if (READ_METHODS.contains(name)) {
            return AccessType.READ;
        }
        if (WRITE_METHODS.contains(name)) {
            return AccessType.WRITE;
        }
        if (REPLICATE_METHODS.contains(name)) {
            return AccessType.REPLICATE;
        }
        return AccessType.EXECUTE;
    }
}
