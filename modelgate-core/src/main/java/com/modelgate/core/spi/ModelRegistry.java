package com.modelgate.core.spi;

import com.modelgate.core.model.ModelDefinition;

import java.util.Collection;

/**
 * SPI: 模型身份解析
 */
public interface ModelRegistry {

    String ROLE = "Role";
    String ROLE_MAPPING = "RoleMapping";
    String USER = "User";
    String APPLICATION = "Application";
    String ACL = "ACL";
    String SCOPE = "Scope";

    /**
     * 按名称查找模型，不存在返回 null
     */
    ModelDefinition findModel(String name);

    /**
     * 按基础类型查找模型，优先返回继承该类型的模型，其次返回同名模型
     */
    ModelDefinition getModelByType(String baseType);

    Collection<ModelDefinition> getModels();
}
