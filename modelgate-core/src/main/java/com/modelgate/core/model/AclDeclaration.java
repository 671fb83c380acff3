package com.modelgate.core.model;

import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Permission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 模型定义中声明的静态 ACL
 * <p>
 * property 可以是单个名称，也可以是名称列表。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AclDeclaration {

    /**
     * String 或 List&lt;String&gt;，缺省为通配
     */
    private Object property;

    /**
     * 访问类型，"*" 或缺省为通配
     */
    private String accessType;

    private String principalType;
    private String principalId;
    private Permission permission;

    public List<String> getPropertyNames() {
        if (property == null) {
            return Collections.emptyList();
        }
        if (property instanceof Collection<?> names) {
            return names.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of(property.toString());
    }

    /**
     * 声明是否覆盖给定属性
     * <p>
     * 未声明或声明为通配时覆盖全部；声明为列表时只覆盖列表中的属性。
     * </p>
     */
    public boolean appliesTo(String requestedProperty) {
        if (property == null) {
            return true;
        }
        List<String> names = getPropertyNames();
        if (property instanceof Collection) {
            return names.contains(requestedProperty);
        }
        return AclRule.ALL.equals(names.get(0)) || names.get(0).equals(requestedProperty);
    }

    /**
     * 展开为针对给定属性的规则，调用前应先经过 {@link #appliesTo(String)}
     */
    public AclRule toRule(String model, String requestedProperty) {
        String ruleProperty;
        if (property == null) {
            ruleProperty = AclRule.ALL;
        } else if (property instanceof Collection) {
            ruleProperty = requestedProperty;
        } else {
            ruleProperty = property.toString();
        }
        return AclRule.builder()
                .model(model)
                .property(ruleProperty)
                .accessType(AccessType.of(accessType))
                .principalType(principalType)
                .principalId(principalId)
                .permission(permission)
                .build();
    }
}
