package com.modelgate.api.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ACL 规则
 * <p>
 * 静态规则 (模型定义中声明) 与动态规则 (存储在 ACL 表中) 结构完全一致，解析前合并。
 * model / property / accessType 缺省即通配。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AclRule {

    public static final String ALL = "*";

    private Object id;
    private String model;
    private String property;
    private AccessType accessType;
    private String principalType;
    private String principalId;
    private Permission permission;

    /**
     * 规则是否放行，DEFAULT 按给定默认权限处理
     */
    public boolean isAllowed(Permission defaultPermission) {
        Permission p = permission;
        if (p == null || p == Permission.DEFAULT) {
            p = defaultPermission != null ? defaultPermission : Permission.ALLOW;
        }
        return p != Permission.DENY;
    }

    public boolean isRoleRule() {
        return Principal.ROLE.equals(principalType);
    }

    /**
     * 转换为存储文档
     */
    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (id != null) {
            data.put("id", id);
        }
        data.put("model", model);
        data.put("property", property);
        data.put("accessType", accessType == null ? null : accessType.value());
        data.put("principalType", principalType);
        data.put("principalId", principalId);
        data.put("permission", permission == null ? null : permission.name());
        return data;
    }

    /**
     * 从存储文档还原
     */
    public static AclRule fromData(Map<String, Object> data) {
        Object accessType = data.get("accessType");
        Object permission = data.get("permission");
        Object principalId = data.get("principalId");
        return AclRule.builder()
                .id(data.get("id"))
                .model((String) data.get("model"))
                .property((String) data.get("property"))
                .accessType(accessType == null ? null : AccessType.of(accessType.toString()))
                .principalType((String) data.get("principalType"))
                .principalId(principalId == null ? null : principalId.toString())
                .permission(permission == null ? null : Permission.of(permission.toString()))
                .build();
    }
}
