package com.modelgate.core.role;

import com.modelgate.api.security.Principal;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.model.RelationDefinition;
import com.modelgate.core.spi.ModelRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * $owner 判定
 * <p>
 * 未配置 ownerRelations 时先看实例的 userId / owner 字段，再看第一条适用的 belongsTo 用户关系；
 * 配置了 ownerRelations 时只看列出的关系 (["*"] 表示全部)，任一命中即为拥有者。
 * </p>
 */
@Slf4j
class OwnershipChecker {

    private final ModelRegistry registry;
    private final boolean multipleUserModels;

    OwnershipChecker(ModelRegistry registry, boolean multipleUserModels) {
        this.registry = registry;
        this.multipleUserModels = multipleUserModels;
    }

    boolean isOwner(ModelDefinition model, Object modelId, Object userId, String principalType) {
        String type = principalType != null ? principalType : Principal.USER;
        if (userId == null) {
            log.debug("isOwner(): no user id was set, returning false");
            return false;
        }

        boolean principalTypeValid = (!multipleUserModels && Principal.USER.equals(type))
                || (multipleUserModels && !Principal.USER.equals(type));
        if (!principalTypeValid) {
            log.debug("isOwner(): principal type {} not valid (multipleUserModels={})", type, multipleUserModels);
            return false;
        }

        if (isUserModel(model) && (Principal.USER.equals(type) || type.equals(model.getName()))) {
            return idMatches(modelId, userId);
        }

        Map<String, Object> inst = model.getStore().findById(modelId);
        if (inst == null) {
            log.debug("isOwner(): {} {} not found", model.getName(), modelId);
            return false;
        }

        if (model.getOwnerRelations() == null) {
            return legacyOwnershipCheck(model, inst, userId, type);
        }
        return relationOwnershipCheck(model, inst, userId, type);
    }

    private boolean legacyOwnershipCheck(ModelDefinition model, Map<String, Object> inst, Object userId, String type) {
        Object ownerId = inst.get("userId") != null ? inst.get("userId") : inst.get("owner");
        if (Principal.USER.equals(type) && ownerId != null) {
            return idMatches(ownerId, userId);
        }
        for (RelationDefinition relation : model.getRelations().values()) {
            ModelDefinition related = userRelationTarget(relation, type);
            if (related != null) {
                // 第一条适用的关系即决定结果
                return relatedUserMatches(related, inst.get(relation.getForeignKeyOrDefault()), userId, relation);
            }
        }
        log.debug("No matching belongsTo relation found for model {} - user {} principalType {}",
                model.getName(), userId, type);
        return false;
    }

    private boolean relationOwnershipCheck(ModelDefinition model, Map<String, Object> inst, Object userId, String type) {
        List<RelationDefinition> candidates = new ArrayList<>();
        for (RelationDefinition relation : model.getRelations().values()) {
            if (userRelationTarget(relation, type) == null) {
                continue;
            }
            if (model.ownerRelationsIncludeAll() || model.getOwnerRelations().contains(relation.getName())) {
                candidates.add(relation);
            }
        }
        if (candidates.isEmpty()) {
            log.debug("No owner relation of {} matches principalType {}", model.getName(), type);
            return false;
        }
        for (RelationDefinition relation : candidates) {
            ModelDefinition related = registry.findModel(relation.getModel());
            if (relatedUserMatches(related, inst.get(relation.getForeignKeyOrDefault()), userId, relation)) {
                return true;
            }
        }
        return false;
    }

    /**
     * belongsTo 且指向与主体类型相符的用户模型时返回该模型
     */
    private ModelDefinition userRelationTarget(RelationDefinition relation, String type) {
        if (relation.getType() != RelationDefinition.Type.BELONGS_TO) {
            return null;
        }
        ModelDefinition related = registry.findModel(relation.getModel());
        if (!isUserModel(related)) {
            return null;
        }
        boolean applicable = (!multipleUserModels && Principal.USER.equals(type))
                || (multipleUserModels && type.equals(related.getName()));
        return applicable ? related : null;
    }

    private boolean relatedUserMatches(ModelDefinition related, Object foreignKey, Object userId, RelationDefinition relation) {
        if (foreignKey == null) {
            return false;
        }
        Map<String, Object> user = related.getStore().findById(foreignKey);
        if (user == null) {
            return false;
        }
        log.debug("User found: {} (through {})", user.get(related.getIdName()), relation.getName());
        return idMatches(user.get(related.getIdName()), userId);
    }

    static boolean isUserModel(ModelDefinition model) {
        return model != null && model.isOfType(ModelRegistry.USER);
    }

    static boolean idMatches(Object id1, Object id2) {
        if (id1 == null || id2 == null || "".equals(id1) || "".equals(id2)) {
            return false;
        }
        return id1.equals(id2) || id1.toString().equals(id2.toString());
    }
}
