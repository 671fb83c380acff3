package com.modelgate.core.security;

import com.modelgate.api.exception.ValidationException;
import com.modelgate.api.security.AccessControlService;
import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.AccessToken;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Principal;
import com.modelgate.core.audit.AuditManager;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.model.AclDeclaration;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.role.RoleRegistry;
import com.modelgate.core.spi.ModelRegistry;
import com.modelgate.core.store.Filter;
import com.modelgate.core.store.Where;
import com.modelgate.core.util.Futures;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 默认访问控制服务
 * 职责：汇总静态规则与动态规则，判定角色成员关系，交给 {@link PermissionResolver} 裁决，
 * 并把 AUDIT / ALARM / DENY 结果交给审计
 */
@Slf4j
public class DefaultAccessControlService implements AccessControlService {

    private final ModelRegistry registry;
    private final RoleRegistry roleRegistry;
    private final PermissionResolver resolver;
    private final AuditManager auditManager;
    private final ModelGateConfig config;

    public DefaultAccessControlService(ModelRegistry registry, RoleRegistry roleRegistry,
                                       AuditManager auditManager, ModelGateConfig config) {
        this.registry = registry;
        this.roleRegistry = roleRegistry;
        this.auditManager = auditManager;
        this.config = config;
        this.resolver = new PermissionResolver(new RuleScorer(config.getPermissionOrder()));
    }

    @Override
    public AccessRequest checkPermission(String principalType, Object principalId, String model,
                                         String property, AccessType accessType) {
        String principal = principalId == null ? null : principalId.toString();
        String prop = property == null || property.isEmpty() ? AclRule.ALL : property;
        AccessType type = accessType == null ? AccessType.ALL : accessType;

        AccessRequest request = AccessRequest.of(model, prop, type);
        Permission defaultPermission = defaultPermissionFor(model);

        List<AclRule> rules = getStaticAcls(model, prop);
        AccessRequest resolved = resolver.resolvePermission(rules, request, defaultPermission);
        if (resolved.getPermission() == Permission.DENY) {
            // 静态 DENY 不能被动态规则覆盖
            log.debug("Static DENY for {} {} on {}.{}", principalType, principal, model, prop);
            return record(principalsOf(principalType, principal), resolved);
        }

        Where where = Where.eq("principalType", principalType)
                .andEq("principalId", principal)
                .andEq("model", model);
        if (!AclRule.ALL.equals(prop)) {
            where.andInq("property", List.of(prop, AclRule.ALL));
        }
        if (type != AccessType.ALL) {
            where.andInq("accessType", List.of(type.value(), AclRule.ALL, AccessType.EXECUTE.value()));
        }

        List<AclRule> combined = new ArrayList<>(rules);
        combined.addAll(findDynamicAcls(where));
        resolved = resolver.resolvePermission(combined, request, defaultPermission);
        return record(principalsOf(principalType, principal), resolved);
    }

    /**
     * 针对主体集合的完整检查
     * <p>
     * scope 检查最先执行；随后非 ROLE 规则按主体精确匹配直接生效，ROLE 规则并发判定成员关系。
     * 放行时把授权角色写入 {@code context.options["authorizedRoles"]}，拒绝时清空。
     * 角色判定中的存储异常中止整个检查并原样抛出。
     * </p>
     */
    public AccessRequest checkAccessForContext(AccessContext context) {
        ModelDefinition model = context.getModel() != null ? context.getModel() : registry.findModel(context.getModelName());
        if (model == null) {
            throw new ValidationException(ValidationException.MODEL_NOT_FOUND, 404,
                    "Model not found: " + context.getModelName());
        }
        Permission modelDefault = defaultPermissionFor(model.getName());
        String property = context.getProperty();
        AccessType accessType = context.getAccessType();

        AccessRequest request = AccessRequest.builder()
                .model(model.getName())
                .property(property)
                .accessType(accessType)
                .permission(Permission.DEFAULT)
                .methodNames(context.getMethodNames())
                .build();

        if (!context.isScopeAllowed()) {
            log.warn("DENY: scope check failed for {}.{}, granted {} but requires {}",
                    model.getName(), property, context.getGrantedScopes(), context.getRequiredScopes());
            saveAuthorizedRoles(context, new LinkedHashMap<>());
            return record(context.getPrincipals(), request.withPermission(Permission.DENY));
        }

        Where where = Where.inq("model", List.of(model.getName(), AclRule.ALL));
        if (!AclRule.ALL.equals(property)) {
            List<String> properties = new ArrayList<>(context.getMethodNames());
            properties.add(property);
            properties.add(AclRule.ALL);
            where.andInq("property", properties);
        }
        if (accessType == AccessType.REPLICATE) {
            where.andInq("accessType", List.of(AccessType.REPLICATE.value(), AccessType.WRITE.value(), AclRule.ALL));
        } else if (accessType != AccessType.ALL) {
            where.andInq("accessType", List.of(accessType.value(), AclRule.ALL));
        }

        List<AclRule> acls = new ArrayList<>(getStaticAcls(model.getName(), property));
        acls.addAll(findDynamicAcls(where));

        boolean[] effective = new boolean[acls.size()];
        for (int i = 0; i < acls.size(); i++) {
            AclRule acl = acls.get(i);
            for (Principal p : context.getPrincipals()) {
                if (p.matches(acl.getPrincipalType(), acl.getPrincipalId())) {
                    effective[i] = true;
                    break;
                }
            }
        }

        // ROLE 规则并发判定
        List<Integer> roleIndexes = new ArrayList<>();
        List<CompletableFuture<Boolean>> roleChecks = new ArrayList<>();
        for (int i = 0; i < acls.size(); i++) {
            AclRule acl = acls.get(i);
            if (acl.isRoleRule() && !effective[i]) {
                roleIndexes.add(i);
                roleChecks.add(roleRegistry.isInRole(acl.getPrincipalId(), context));
            }
        }
        List<Boolean> inRole = Futures.joinAll(roleChecks);

        Map<String, Object> authorizedRoles = new LinkedHashMap<>();
        for (int k = 0; k < roleIndexes.size(); k++) {
            if (Boolean.TRUE.equals(inRole.get(k))) {
                int index = roleIndexes.get(k);
                AclRule acl = acls.get(index);
                effective[index] = true;
                if (acl.isAllowed(modelDefault)) {
                    authorizedRoles.put(acl.getPrincipalId(), Boolean.TRUE);
                }
            }
        }

        List<AclRule> effectiveAcls = new ArrayList<>();
        for (int i = 0; i < acls.size(); i++) {
            if (effective[i]) {
                effectiveAcls.add(acls.get(i));
            }
        }

        AccessRequest resolved = resolver.resolvePermission(effectiveAcls, request, modelDefault);
        if (!resolved.isAllowed()) {
            log.warn("DENY: {} on {}.{} ({})", context.getPrincipals(), model.getName(), property, accessType);
            authorizedRoles.clear();
        }
        saveAuthorizedRoles(context, authorizedRoles);
        return record(context.getPrincipals(), resolved);
    }

    @Override
    public boolean checkAccessForToken(AccessToken token, String model, Object modelId, String method) {
        if (token == null) {
            throw new ValidationException(ValidationException.ACCESS_TOKEN_REQUIRED, "Access token is required");
        }
        ModelDefinition definition = registry.findModel(model);
        AccessContext context = AccessContext.builder()
                .accessToken(token)
                .model(definition)
                .modelName(model)
                .modelId(modelId)
                .property(method)
                .method(method)
                .build();
        return checkAccessForContext(context).isAllowed();
    }

    @Override
    public AccessRequest resolvePermission(List<AclRule> rules, AccessRequest request) {
        return resolver.resolvePermission(rules, request, defaultPermissionFor(request.getModel()));
    }

    @Override
    public int getMatchingScore(AclRule rule, AccessRequest request) {
        return resolver.getScorer().getMatchingScore(rule, request);
    }

    /**
     * 模型声明的静态规则：模型级 ACL (property 为空、通配、等于或包含请求属性) + 属性/方法上内嵌的 ACL
     */
    public List<AclRule> getStaticAcls(String model, String property) {
        List<AclRule> rules = new ArrayList<>();
        ModelDefinition definition = registry.findModel(model);
        if (definition == null) {
            return rules;
        }
        for (AclDeclaration declaration : definition.getAcls()) {
            if (declaration.appliesTo(property)) {
                rules.add(declaration.toRule(model, property));
            }
        }
        for (AclDeclaration declaration : definition.getEmbeddedAcls(property)) {
            AclRule rule = declaration.toRule(definition.getName(), property);
            rule.setProperty(property);
            rules.add(rule);
        }
        return rules;
    }

    /**
     * 按类型和 ID (或名称) 解析主体
     *
     * @return 主体记录，找不到时返回 null
     * @throws ValidationException 未知主体类型
     */
    public Map<String, Object> resolvePrincipal(String type, Object id) {
        String principalType = type == null ? Principal.ROLE : type;
        switch (principalType) {
            case Principal.ROLE:
                return findByAnyOf(requireModel(ModelRegistry.ROLE), id, "name");
            case Principal.USER:
                return findByAnyOf(requireModel(ModelRegistry.USER), id, "username", "email");
            case Principal.APPLICATION:
                return findByAnyOf(requireModel(ModelRegistry.APPLICATION), id, "name", "email");
            default:
                ModelDefinition userModel = registry.findModel(principalType);
                if (userModel == null) {
                    throw new ValidationException(ValidationException.INVALID_PRINCIPAL_TYPE,
                            "Invalid principal type: " + principalType);
                }
                return findByAnyOf(userModel, id, "username", "email");
        }
    }

    /**
     * 主体是否映射到角色
     */
    public boolean isMappedToRole(String principalType, Object principalId, Object role) {
        String type = principalType == null ? Principal.ROLE : principalType;
        Object id = principalId;
        Map<String, Object> principal = resolvePrincipal(type, principalId);
        if (principal != null) {
            id = principal.get("id");
        }
        Map<String, Object> roleDoc = resolvePrincipal(Principal.ROLE, role);
        if (roleDoc == null) {
            return false;
        }
        ModelDefinition mapping = requireModel(ModelRegistry.ROLE_MAPPING);
        return mapping.getStore().findOne(Filter.where(Where.eq("roleId", roleDoc.get("id"))
                .andEq("principalType", type)
                .andEq("principalId", String.valueOf(id)))) != null;
    }

    public PermissionResolver getResolver() {
        return resolver;
    }

    private Map<String, Object> findByAnyOf(ModelDefinition model, Object id, String... fields) {
        Where where = Where.create();
        Where[] alternatives = new Where[fields.length + 1];
        for (int i = 0; i < fields.length; i++) {
            alternatives[i] = Where.eq(fields[i], id);
        }
        alternatives[fields.length] = Where.eq(model.getIdName(), id);
        where.or(alternatives);
        return model.getStore().findOne(Filter.where(where));
    }

    private List<AclRule> findDynamicAcls(Where where) {
        ModelDefinition aclModel = registry.getModelByType(ModelRegistry.ACL);
        if (aclModel == null) {
            return List.of();
        }
        List<AclRule> rules = new ArrayList<>();
        for (Map<String, Object> doc : aclModel.getStore().find(Filter.where(where))) {
            rules.add(AclRule.fromData(doc));
        }
        return rules;
    }

    private Permission defaultPermissionFor(String model) {
        ModelDefinition definition = model == null ? null : registry.findModel(model);
        if (definition != null && definition.getDefaultPermission() != null) {
            return definition.getDefaultPermission();
        }
        return config.getDefaultPermission();
    }

    private ModelDefinition requireModel(String type) {
        ModelDefinition model = registry.getModelByType(type);
        if (model == null) {
            throw new IllegalStateException(type + " model is not registered");
        }
        return model;
    }

    private static List<Principal> principalsOf(String principalType, String principalId) {
        return principalType == null ? List.of() : List.of(new Principal(principalType, principalId));
    }

    private static void saveAuthorizedRoles(AccessContext context, Map<String, Object> authorizedRoles) {
        if (context.getOptions() != null) {
            context.getOptions().put(AccessContext.AUTHORIZED_ROLES, authorizedRoles);
        }
    }

    private AccessRequest record(List<Principal> principals, AccessRequest resolved) {
        if (auditManager != null && AuditManager.isAudited(resolved.getPermission())) {
            auditManager.asyncRecord(principals, resolved);
        }
        return resolved;
    }
}
