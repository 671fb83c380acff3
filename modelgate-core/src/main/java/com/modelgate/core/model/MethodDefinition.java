package com.modelgate.core.model;

import com.modelgate.api.security.AccessType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型方法元数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MethodDefinition {

    private String name;

    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    /**
     * 显式声明的访问类型，缺省时按方法名推断
     */
    private AccessType accessType;

    /**
     * 调用所需 scope，缺省为默认 scope
     */
    @Builder.Default
    private List<String> accessScopes = new ArrayList<>();

    /**
     * 方法上内嵌的 ACL
     */
    @Builder.Default
    private List<AclDeclaration> acls = new ArrayList<>();

    public boolean answersTo(String methodName) {
        return name.equals(methodName) || (aliases != null && aliases.contains(methodName));
    }

    /**
     * 方法名加别名
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        names.add(name);
        if (aliases != null) {
            names.addAll(aliases);
        }
        return names;
    }
}
