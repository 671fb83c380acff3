package com.modelgate.core.model;

import com.modelgate.api.security.Permission;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 从 YAML 加载模型定义
 * <p>
 * 每个 YAML 文档描述一个模型，多个模型以 {@code ---} 分隔。
 * methods / relations 的 map key 即为名称，条目内可省略 name。
 * </p>
 */
@Slf4j
public class ModelDefinitionLoader {

    public static List<ModelDefinition> load(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ModelDefinition.class, options);
        Yaml yaml = new Yaml(constructor);

        List<ModelDefinition> definitions = new ArrayList<>();
        for (Object document : yaml.loadAll(inputStream)) {
            if (document == null) {
                continue;
            }
            ModelDefinition definition = (ModelDefinition) document;
            if (definition.getName() == null || definition.getName().isBlank()) {
                throw new IllegalArgumentException("Model definition without name");
            }
            fillNames(definition);
            definitions.add(definition);
            log.debug("Loaded model definition [{}]", definition.getName());
        }
        return definitions;
    }

    private static void fillNames(ModelDefinition definition) {
        for (Map.Entry<String, MethodDefinition> entry : definition.getMethods().entrySet()) {
            if (entry.getValue().getName() == null) {
                entry.getValue().setName(entry.getKey());
            }
        }
        for (Map.Entry<String, RelationDefinition> entry : definition.getRelations().entrySet()) {
            if (entry.getValue().getName() == null) {
                entry.getValue().setName(entry.getKey());
            }
        }
        // 嵌套两层的泛型 (Map 中的 List) 无法推断元素类型，按 Map 读入后再转换
        for (Map.Entry<String, List<AclDeclaration>> entry : definition.getPropertyAcls().entrySet()) {
            List<AclDeclaration> converted = new ArrayList<>();
            for (Object item : (List<?>) entry.getValue()) {
                if (item instanceof AclDeclaration declaration) {
                    converted.add(declaration);
                } else if (item instanceof Map<?, ?> raw) {
                    converted.add(toDeclaration(raw));
                }
            }
            entry.setValue(converted);
        }
    }

    private static AclDeclaration toDeclaration(Map<?, ?> raw) {
        Object permission = raw.get("permission");
        Object accessType = raw.get("accessType");
        Object principalId = raw.get("principalId");
        return AclDeclaration.builder()
                .property(raw.get("property"))
                .accessType(accessType == null ? null : accessType.toString())
                .principalType((String) raw.get("principalType"))
                .principalId(principalId == null ? null : principalId.toString())
                .permission(permission == null ? null : Permission.of(permission.toString()))
                .build();
    }
}
