package com.modelgate.core.model;

import com.modelgate.api.security.Permission;
import com.modelgate.core.spi.ModelStore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模型定义
 * <p>
 * 承载 ACL 解析需要的全部静态元数据，以及模型对应的持久化能力集。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDefinition {

    public static final String PERSISTED_MODEL = "PersistedModel";

    private String name;

    /**
     * 基础类型，例如 User / Role / RoleMapping / Application
     */
    @Builder.Default
    private String baseType = PERSISTED_MODEL;

    @Builder.Default
    private String idName = "id";

    /**
     * 模型级静态 ACL
     */
    @Builder.Default
    private List<AclDeclaration> acls = new ArrayList<>();

    /**
     * 属性/关系上内嵌的 ACL，key 为属性名
     */
    @Builder.Default
    private Map<String, List<AclDeclaration>> propertyAcls = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, MethodDefinition> methods = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, RelationDefinition> relations = new LinkedHashMap<>();

    /**
     * 模型自身的默认权限，null 时使用全局配置
     */
    private Permission defaultPermission;

    /**
     * 判定 $owner 时使用的 belongsTo 关系
     * <p>
     * null: 先看 userId / owner 字段，再看所有指向用户模型的 belongsTo
     * <p>
     * ["*"]: 所有指向用户模型的 belongsTo
     */
    private List<String> ownerRelations;

    @ToString.Exclude
    private ModelStore store;

    public boolean isOfType(String type) {
        return type != null && (type.equals(name) || type.equals(baseType));
    }

    /**
     * 按方法名或别名查找方法
     */
    public MethodDefinition findMethod(String methodName) {
        if (methodName == null) {
            return null;
        }
        MethodDefinition direct = methods.get(methodName);
        if (direct != null) {
            return direct;
        }
        for (MethodDefinition m : methods.values()) {
            if (m.answersTo(methodName)) {
                return m;
            }
        }
        return null;
    }

    public boolean ownerRelationsIncludeAll() {
        return ownerRelations != null && ownerRelations.contains("*");
    }

    /**
     * 方法或属性上内嵌的 ACL
     */
    public List<AclDeclaration> getEmbeddedAcls(String property) {
        List<AclDeclaration> result = new ArrayList<>();
        List<AclDeclaration> declared = propertyAcls.get(property);
        if (declared != null) {
            result.addAll(declared);
        }
        MethodDefinition method = methods.get(property);
        if (method != null && method.getAcls() != null) {
            result.addAll(method.getAcls());
        }
        return result;
    }
}
