package com.modelgate.core.store;

import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.spi.ModelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认模型注册表
 * 职责：维护模型名到定义的映射，未提供存储的模型自动挂接内存存储
 */
@Slf4j
public class DefaultModelRegistry implements ModelRegistry {

    private final Map<String, ModelDefinition> models = new ConcurrentHashMap<>();

    public ModelDefinition register(ModelDefinition definition) {
        if (definition.getStore() == null) {
            definition.setStore(new InMemoryModelStore(definition.getName(), definition.getIdName()));
        }
        ModelDefinition previous = models.put(definition.getName(), definition);
        if (previous != null) {
            log.warn("Model [{}] re-registered, previous definition replaced", definition.getName());
        } else {
            log.debug("Model [{}] registered (base: {})", definition.getName(), definition.getBaseType());
        }
        return definition;
    }

    @Override
    public ModelDefinition findModel(String name) {
        return name == null ? null : models.get(name);
    }

    @Override
    public ModelDefinition getModelByType(String baseType) {
        for (ModelDefinition candidate : models.values()) {
            if (baseType.equals(candidate.getBaseType()) && !baseType.equals(candidate.getName())) {
                return candidate;
            }
        }
        return models.get(baseType);
    }

    @Override
    public Collection<ModelDefinition> getModels() {
        return Collections.unmodifiableCollection(models.values());
    }
}
