package com.modelgate.core.security;

import com.modelgate.api.exception.ValidationException;
import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.AccessToken;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Principal;
import com.modelgate.api.security.Roles;
import com.modelgate.core.audit.AuditManager;
import com.modelgate.core.config.ModelGateConfig;
import com.modelgate.core.model.AclDeclaration;
import com.modelgate.core.model.MethodDefinition;
import com.modelgate.core.model.ModelDefinition;
import com.modelgate.core.role.RoleRegistry;
import com.modelgate.core.spi.ModelRegistry;
import com.modelgate.core.store.DefaultModelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultAccessControlService 单元测试")
public class DefaultAccessControlServiceTest {

    @Mock
    private AuditManager auditManager;

    private DefaultModelRegistry registry;
    private RoleRegistry roleRegistry;
    private DefaultAccessControlService service;
    private ModelDefinition account;

    @BeforeEach
    void setUp() {
        ModelGateConfig config = ModelGateConfig.builder().roleCheckThreads(2).build();
        registry = new DefaultModelRegistry();
        registry.register(ModelDefinition.builder().name(ModelRegistry.ACL).baseType(ModelRegistry.ACL).build());
        registry.register(ModelDefinition.builder().name(ModelRegistry.ROLE).baseType(ModelRegistry.ROLE).build());
        registry.register(ModelDefinition.builder().name(ModelRegistry.ROLE_MAPPING).baseType(ModelRegistry.ROLE_MAPPING).build());
        registry.register(ModelDefinition.builder().name(ModelRegistry.USER).baseType(ModelRegistry.USER).build());
        registry.register(ModelDefinition.builder().name(ModelRegistry.SCOPE).baseType(ModelRegistry.SCOPE).build());

        MethodDefinition find = MethodDefinition.builder()
                .name("find")
                .aliases(List.of("list"))
                .accessType(AccessType.READ)
                .build();
        MethodDefinition export = MethodDefinition.builder()
                .name("export")
                .accessType(AccessType.READ)
                .accessScopes(List.of("reporting"))
                .build();
        Map<String, MethodDefinition> methods = new LinkedHashMap<>();
        methods.put("find", find);
        methods.put("export", export);
        account = registry.register(ModelDefinition.builder().name("account").methods(methods).build());

        roleRegistry = new RoleRegistry(registry, config);
        service = new DefaultAccessControlService(registry, roleRegistry, auditManager, config);
    }

    @AfterEach
    void tearDown() {
        roleRegistry.shutdown();
    }

    private void storeAcl(String property, String accessType, String principalType, String principalId, Permission permission) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("model", "account");
        doc.put("property", property);
        doc.put("accessType", accessType);
        doc.put("principalType", principalType);
        doc.put("principalId", principalId);
        doc.put("permission", permission.name());
        registry.findModel(ModelRegistry.ACL).getStore().create(doc);
    }

    private void declareAcl(String accessType, String role, Permission permission) {
        account.getAcls().add(AclDeclaration.builder()
                .accessType(accessType)
                .principalType(Principal.ROLE)
                .principalId(role)
                .permission(permission)
                .build());
    }

    @Nested
    @DisplayName("checkPermission")
    class CheckPermissionTests {

        @Test
        @DisplayName("存储的主体规则生效")
        void storedRuleShouldApplyToItsPrincipal() {
            storeAcl("*", "READ", Principal.USER, "u1", Permission.DENY);

            assertEquals(Permission.DENY,
                    service.checkPermission(Principal.USER, "u1", "account", "find", AccessType.READ).getPermission());
            assertEquals(Permission.ALLOW,
                    service.checkPermission(Principal.USER, "u2", "account", "find", AccessType.READ).getPermission());
        }

        @Test
        @DisplayName("静态 DENY 不会被存储规则覆盖")
        void staticDenyShouldShortCircuit() {
            declareAcl("WRITE", Roles.EVERYONE, Permission.DENY);
            storeAcl("find", "WRITE", Principal.USER, "u1", Permission.ALLOW);

            AccessRequest resolved = service.checkPermission(Principal.USER, "u1", "account", "find", AccessType.WRITE);

            assertEquals(Permission.DENY, resolved.getPermission());
        }

        @Test
        @DisplayName("DENY 结果交给审计")
        void denyShouldBeAudited() {
            storeAcl("*", "*", Principal.USER, "u1", Permission.DENY);

            service.checkPermission(Principal.USER, "u1", "account", "find", AccessType.READ);

            verify(auditManager).asyncRecord(anyList(), any(AccessRequest.class));
        }

        @Test
        @DisplayName("ALLOW 结果不审计")
        void allowShouldNotBeAudited() {
            service.checkPermission(Principal.USER, "u1", "account", "find", AccessType.READ);

            verify(auditManager, never()).asyncRecord(anyList(), any(AccessRequest.class));
        }

        @Test
        @DisplayName("模型默认权限优先于全局默认")
        void modelDefaultShouldApply() {
            account.setDefaultPermission(Permission.DENY);

            assertEquals(Permission.DENY,
                    service.checkPermission(Principal.USER, "u1", "account", "find", AccessType.READ).getPermission());
        }
    }

    @Nested
    @DisplayName("checkAccessForContext")
    class CheckAccessForContextTests {

        @Test
        @DisplayName("放行时记录授权角色")
        void allowShouldRecordAuthorizedRoles() {
            declareAcl("READ", Roles.AUTHENTICATED, Permission.ALLOW);
            Map<String, Object> options = new HashMap<>();

            AccessRequest resolved = service.checkAccessForContext(AccessContext.builder()
                    .principals(List.of(Principal.user("u1")))
                    .model(account)
                    .method("find")
                    .options(options)
                    .build());

            assertEquals(Permission.ALLOW, resolved.getPermission());
            @SuppressWarnings("unchecked")
            Map<String, Object> roles = (Map<String, Object>) options.get(AccessContext.AUTHORIZED_ROLES);
            assertEquals(Boolean.TRUE, roles.get(Roles.AUTHENTICATED));
        }

        @Test
        @DisplayName("拒绝时清空授权角色")
        void denyShouldClearAuthorizedRoles() {
            declareAcl("*", Roles.EVERYONE, Permission.DENY);
            declareAcl("READ", Roles.AUTHENTICATED, Permission.ALLOW);
            Map<String, Object> options = new HashMap<>();

            AccessRequest resolved = service.checkAccessForContext(AccessContext.builder()
                    .model(account)
                    .method("find")
                    .options(options)
                    .build());

            assertEquals(Permission.DENY, resolved.getPermission());
            assertTrue(((Map<?, ?>) options.get(AccessContext.AUTHORIZED_ROLES)).isEmpty());
        }

        @Test
        @DisplayName("方法别名上的存储规则生效")
        void aliasRuleShouldApply() {
            storeAcl("list", "READ", Principal.USER, "u1", Permission.DENY);

            AccessRequest resolved = service.checkAccessForContext(AccessContext.builder()
                    .principals(List.of(Principal.user("u1")))
                    .model(account)
                    .method("find")
                    .build());

            assertEquals(Permission.DENY, resolved.getPermission());
        }

        @Test
        @DisplayName("通过 RoleMapping 判定存储的角色")
        void storedRoleMappingShouldGrantAccess() {
            account.setDefaultPermission(Permission.DENY);
            declareAcl("READ", "admin", Permission.ALLOW);
            Map<String, Object> role = registry.findModel(ModelRegistry.ROLE).getStore()
                    .create(new LinkedHashMap<>(Map.of("name", "admin")));
            registry.findModel(ModelRegistry.ROLE_MAPPING).getStore().create(new LinkedHashMap<>(Map.of(
                    "roleId", role.get("id").toString(),
                    "principalType", Principal.USER,
                    "principalId", "u1")));

            AccessContext member = AccessContext.builder()
                    .principals(List.of(Principal.user("u1")))
                    .model(account)
                    .method("find")
                    .build();
            AccessContext stranger = AccessContext.builder()
                    .principals(List.of(Principal.user("u2")))
                    .model(account)
                    .method("find")
                    .build();

            assertEquals(Permission.ALLOW, service.checkAccessForContext(member).getPermission());
            assertEquals(Permission.DENY, service.checkAccessForContext(stranger).getPermission());
        }

        @Test
        @DisplayName("令牌 scope 不满足方法要求时拒绝")
        void missingScopeShouldDeny() {
            declareAcl("*", Roles.EVERYONE, Permission.ALLOW);
            Map<String, Object> options = new HashMap<>();
            AccessToken token = AccessToken.builder().userId("u1").scopes(List.of("DEFAULT")).build();

            AccessRequest resolved = service.checkAccessForContext(AccessContext.builder()
                    .accessToken(token)
                    .model(account)
                    .method("export")
                    .options(options)
                    .build());

            assertEquals(Permission.DENY, resolved.getPermission());
            assertTrue(((Map<?, ?>) options.get(AccessContext.AUTHORIZED_ROLES)).isEmpty());
        }

        @Test
        @DisplayName("角色判定异常中止检查并原样抛出")
        void roleCheckFailureShouldPropagate() {
            declareAcl("*", "flaky", Permission.ALLOW);
            roleRegistry.registerResolver("flaky", (role, context) ->
                    CompletableFuture.failedFuture(new IllegalStateException("role store unavailable")));

            IllegalStateException e = assertThrows(IllegalStateException.class, () ->
                    service.checkAccessForContext(AccessContext.builder()
                            .principals(List.of(Principal.user("u1")))
                            .model(account)
                            .method("find")
                            .build()));
            assertEquals("role store unavailable", e.getMessage());
        }

        @Test
        @DisplayName("模型不存在时抛出 MODEL_NOT_FOUND")
        void unknownModelShouldFail() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    service.checkAccessForContext(AccessContext.builder().modelName("missing").method("find").build()));
            assertEquals(ValidationException.MODEL_NOT_FOUND, e.getCode());
            assertEquals(404, e.getStatusCode());
        }
    }

    @Nested
    @DisplayName("令牌与主体")
    class TokenAndPrincipalTests {

        @Test
        @DisplayName("缺少令牌时抛出 ACCESS_TOKEN_REQUIRED")
        void nullTokenShouldFail() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    service.checkAccessForToken(null, "account", 1, "find"));
            assertEquals(ValidationException.ACCESS_TOKEN_REQUIRED, e.getCode());
        }

        @Test
        @DisplayName("令牌中的用户作为主体参与判定")
        void tokenUserShouldBeEvaluated() {
            account.setDefaultPermission(Permission.DENY);
            declareAcl("READ", Roles.AUTHENTICATED, Permission.ALLOW);

            assertTrue(service.checkAccessForToken(AccessToken.builder().userId("u1").build(), "account", 1, "find"));
            assertFalse(service.checkAccessForToken(AccessToken.builder().build(), "account", 1, "find"));
        }

        @Test
        @DisplayName("未知主体类型抛出 INVALID_PRINCIPAL_TYPE")
        void unknownPrincipalTypeShouldFail() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    service.resolvePrincipal("ROBOT", "r1"));
            assertEquals(ValidationException.INVALID_PRINCIPAL_TYPE, e.getCode());
            assertEquals(400, e.getStatusCode());
        }

        @Test
        @DisplayName("按用户名解析用户")
        void shouldResolveUserByUsername() {
            registry.findModel(ModelRegistry.USER).getStore()
                    .create(new LinkedHashMap<>(Map.of("id", "u1", "username", "alice")));

            Map<String, Object> user = service.resolvePrincipal(Principal.USER, "alice");

            assertNotNull(user);
            assertEquals("u1", user.get("id"));
        }

        @Test
        @DisplayName("主体到角色的映射")
        void shouldDetectRoleMapping() {
            Map<String, Object> role = registry.findModel(ModelRegistry.ROLE).getStore()
                    .create(new LinkedHashMap<>(Map.of("name", "admin")));
            registry.findModel(ModelRegistry.ROLE_MAPPING).getStore().create(new LinkedHashMap<>(Map.of(
                    "roleId", role.get("id"),
                    "principalType", Principal.USER,
                    "principalId", "u1")));

            assertTrue(service.isMappedToRole(Principal.USER, "u1", "admin"));
            assertFalse(service.isMappedToRole(Principal.USER, "u2", "admin"));
            assertFalse(service.isMappedToRole(Principal.USER, "u1", "guest"));
        }
    }

    @Nested
    @DisplayName("ScopeService")
    class ScopeTests {

        @Test
        @DisplayName("scope 以 SCOPE 主体身份检查")
        void scopeShouldBeCheckedAsPrincipal() {
            Map<String, Object> scope = registry.findModel(ModelRegistry.SCOPE).getStore()
                    .create(new LinkedHashMap<>(Map.of("name", "reporting")));
            storeAcl("*", "WRITE", Principal.SCOPE, scope.get("id").toString(), Permission.DENY);
            ScopeService scopes = new ScopeService(registry, service);

            assertEquals(Permission.DENY, scopes.checkPermission("reporting", "account", "find", AccessType.WRITE).getPermission());
            assertEquals(Permission.ALLOW, scopes.checkPermission("reporting", "account", "find", AccessType.READ).getPermission());
        }

        @Test
        @DisplayName("未知 scope 抛出 SCOPE_NOT_FOUND")
        void unknownScopeShouldFail() {
            ScopeService scopes = new ScopeService(registry, service);

            ValidationException e = assertThrows(ValidationException.class, () ->
                    scopes.checkPermission("missing", "account", "find", AccessType.READ));
            assertEquals(ValidationException.SCOPE_NOT_FOUND, e.getCode());
            assertEquals(403, e.getStatusCode());
        }
    }

    @Test
    @DisplayName("getMatchingScore 委托给打分器")
    void matchingScoreShouldDelegate() {
        AclRule rule = AclRule.builder().model("account").principalType(Principal.USER).principalId("u1").build();
        AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);

        assertEquals(service.getResolver().getScorer().getMatchingScore(rule, request),
                service.getMatchingScore(rule, request));
    }
}
