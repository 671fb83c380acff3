package com.modelgate.core.security;

import com.modelgate.api.exception.ValidationException;
import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.Principal;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.spi.ModelRegistry;
import com.modelgate.core.store.Filter;
import com.modelgate.core.store.Where;

import java.util.Map;

/**
 * 授权范围 (Scope) 的权限检查
 * Scope 以 SCOPE 类型主体的身份走 {@link DefaultAccessControlService#checkPermission}。
 */
public class ScopeService {

    private final ModelRegistry registry;
    private final DefaultAccessControlService accessControlService;

    public ScopeService(ModelRegistry registry, DefaultAccessControlService accessControlService) {
        this.registry = registry;
        this.accessControlService = accessControlService;
    }

    /**
     * @throws ValidationException scope 不存在 (SCOPE_NOT_FOUND, 403)
     */
    public AccessRequest checkPermission(String scope, String model, String property, AccessType accessType) {
        ModelDefinition scopeModel = registry.getModelByType(ModelRegistry.SCOPE);
        if (scopeModel == null) {
            throw new IllegalStateException("Scope model is not registered");
        }
        Map<String, Object> record = scopeModel.getStore().findOne(Filter.where(Where.eq("name", scope)));
        if (record == null) {
            throw new ValidationException(ValidationException.SCOPE_NOT_FOUND, 403, "Scope " + scope + " not found");
        }
        return accessControlService.checkPermission(Principal.SCOPE, record.get(scopeModel.getIdName()),
                model, property, accessType);
    }
}
