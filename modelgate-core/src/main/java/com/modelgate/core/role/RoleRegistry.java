package com.modelgate.core.role;

import com.modelgate.api.security.Principal;
import com.modelgate.api.security.Roles;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.security.AccessContext;
import com.modelgate.core.spi.ModelRegistry;
import com.modelgate.core.spi.RoleResolver;
import com.modelgate.core.store.Filter;
import com.modelgate.core.store.Where;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 角色注册表
 * <p>
 * 职责：
 * <ul>
 *     <li>维护角色名到判定器的映射，内置 $owner / $authenticated / $unauthenticated / $everyone</li>
 *     <li>未注册的角色先看上下文中的 ROLE 主体，再查 Role / RoleMapping 存储</li>
 *     <li>角色成员关系每次求值，不做缓存</li>
 * </ul>
 * 内置判定器出错视为不在角色中；自定义判定器和存储的异常原样向上传播。
 * </p>
 */
@Slf4j
public class RoleRegistry {

    private final Map<String, RoleResolver> resolvers = new ConcurrentHashMap<>();
    private final ModelRegistry modelRegistry;
    private final OwnershipChecker ownershipChecker;
    private final ExecutorService executor;

    public RoleRegistry(ModelRegistry modelRegistry, ModelGateConfig config) {
        this.modelRegistry = modelRegistry;
        this.ownershipChecker = new OwnershipChecker(modelRegistry, config.isMultipleUserModels());
        int threads = Math.max(1, config.getRoleCheckThreads());
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "modelgate-role-check-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        registerBuiltInResolvers();
    }

    private void registerBuiltInResolvers() {
        registerResolver(Roles.OWNER, (role, context) -> CompletableFuture.supplyAsync(() -> {
            try {
                if (context == null || context.getModel() == null || context.getModelId() == null) {
                    return false;
                }
                Principal user = context.getUser();
                if (user == null) {
                    return false;
                }
                return isOwner(context.getModel(), context.getModelId(), user.id(), user.type());
            } catch (RuntimeException e) {
                log.warn("Owner check failed for {} {}, treating as not owner: {}",
                        context.getModelName(), context.getModelId(), e.getMessage());
                return false;
            }
        }, executor));
        registerResolver(Roles.AUTHENTICATED, (role, context) ->
                CompletableFuture.completedFuture(context != null && context.isAuthenticated()));
        registerResolver(Roles.UNAUTHENTICATED, (role, context) ->
                CompletableFuture.completedFuture(context == null || !context.isAuthenticated()));
        registerResolver(Roles.EVERYONE, (role, context) -> CompletableFuture.completedFuture(true));
    }

    /**
     * 注册 (或替换) 角色判定器
     */
    public void registerResolver(String roleName, RoleResolver resolver) {
        RoleResolver previous = resolvers.put(roleName, resolver);
        if (previous != null) {
            log.debug("Role resolver for {} replaced", roleName);
        }
    }

    /**
     * 判断上下文中的主体是否属于角色
     */
    public CompletableFuture<Boolean> isInRole(String role, AccessContext context) {
        RoleResolver resolver = resolvers.get(role);
        if (resolver != null) {
            log.debug("isInRole(): resolver found for role {}", role);
            CompletableFuture<Boolean> result = resolver.resolve(role, context);
            return result == null ? CompletableFuture.completedFuture(false) : result.thenApply(Boolean.TRUE::equals);
        }

        if (context.getPrincipals().isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        for (Principal p : context.getPrincipals()) {
            if (p.matches(Principal.ROLE, role)) {
                log.debug("isInRole(): {} carried by context principals", role);
                return CompletableFuture.completedFuture(true);
            }
        }

        return CompletableFuture.supplyAsync(() -> findRoleByName(role), executor)
                .thenCompose(roleDoc -> {
                    if (roleDoc == null) {
                        return CompletableFuture.completedFuture(false);
                    }
                    return anyPrincipalMapped(context.getPrincipals(), roleDoc.get(roleModel().getIdName()));
                });
    }

    private CompletableFuture<Boolean> anyPrincipalMapped(List<Principal> principals, Object roleId) {
        List<CompletableFuture<Boolean>> checks = new ArrayList<>();
        ModelDefinition mappingModel = roleMappingModel();
        for (Principal p : principals) {
            if (p.id() == null) {
                continue;
            }
            checks.add(CompletableFuture.supplyAsync(() -> mappingModel.getStore().findOne(Filter.where(
                    Where.eq("roleId", roleId.toString())
                            .andEq("principalType", p.type())
                            .andEq("principalId", p.id().toString()))) != null, executor));
        }
        if (checks.isEmpty()) {
            return CompletableFuture.completedFuture(false);
        }
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]))
                .thenApply(v -> checks.stream().anyMatch(CompletableFuture::join));
    }

    /**
     * 列出上下文所属的全部角色
     *
     * @param returnOnlyRoleNames true 时存储映射的角色以名称返回，否则返回角色 ID
     */
    public CompletableFuture<List<Object>> getRoles(AccessContext context, boolean returnOnlyRoleNames) {
        Set<Object> roles = Collections.synchronizedSet(new LinkedHashSet<>());
        List<CompletableFuture<Void>> tasks = new ArrayList<>();

        List<String> names = new ArrayList<>(List.of(Roles.AUTHENTICATED, Roles.UNAUTHENTICATED, Roles.EVERYONE));
        for (String name : resolvers.keySet()) {
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        for (String name : names) {
            tasks.add(isInRole(name, context).handle((inRole, error) -> {
                if (error != null) {
                    log.warn("Error checking role {}: {}", name, error.getMessage());
                } else if (inRole) {
                    roles.add(name);
                }
                return null;
            }));
        }

        ModelDefinition mappingModel = roleMappingModel();
        for (Principal p : context.getPrincipals()) {
            if (p.id() == null) {
                continue;
            }
            if (Principal.ROLE.equals(p.type())) {
                roles.add(p.id().toString());
            }
            tasks.add(CompletableFuture.runAsync(() -> {
                List<Map<String, Object>> mappings = mappingModel.getStore().find(Filter.where(
                        Where.eq("principalType", p.type()).andEq("principalId", p.id().toString())));
                for (Map<String, Object> mapping : mappings) {
                    Object roleId = mapping.get("roleId");
                    if (returnOnlyRoleNames) {
                        Map<String, Object> roleDoc = roleModel().getStore().findById(roleId);
                        if (roleDoc != null) {
                            roles.add(roleDoc.get("name"));
                        }
                    } else {
                        roles.add(roleId);
                    }
                }
            }, executor));
        }

        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    synchronized (roles) {
                        log.debug("getRoles() returns: {}", roles);
                        return new ArrayList<>(roles);
                    }
                });
    }

    /**
     * 判断用户是否为模型实例的拥有者
     */
    public boolean isOwner(ModelDefinition model, Object modelId, Object userId, String principalType) {
        return ownershipChecker.isOwner(model, modelId, userId, principalType);
    }

    /**
     * 按名称查找存储的角色
     */
    public Map<String, Object> findRoleByName(String name) {
        return roleModel().getStore().findOne(Filter.where(Where.eq("name", name)));
    }

    public ExecutorService getExecutor() {
        return executor;
    }

    ModelDefinition roleModel() {
        return requireModel(ModelRegistry.ROLE);
    }

    ModelDefinition roleMappingModel() {
        return requireModel(ModelRegistry.ROLE_MAPPING);
    }

    private ModelDefinition requireModel(String type) {
        ModelDefinition model = modelRegistry.getModelByType(type);
        if (model == null) {
            throw new IllegalStateException(type + " model must be registered before role lookups");
        }
        return model;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down role check executor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
