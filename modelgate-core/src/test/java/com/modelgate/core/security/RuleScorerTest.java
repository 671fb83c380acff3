package com.modelgate.core.security;

import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Principal;
import com.modelgate.api.security.Roles;
import com.modelgate.core.config.PermissionOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuleScorer 单元测试")
public class RuleScorerTest {

    private final RuleScorer scorer = new RuleScorer(PermissionOrder.defaults());

    private static AclRule rule(String model, String property, AccessType accessType,
                                String principalType, String principalId, Permission permission) {
        return AclRule.builder()
                .model(model)
                .property(property)
                .accessType(accessType)
                .principalType(principalType)
                .principalId(principalId)
                .permission(permission)
                .build();
    }

    @Nested
    @DisplayName("字段匹配")
    class FieldMatchTests {

        @Test
        @DisplayName("三个字段精确匹配的规则得分高于全通配规则")
        void exactRuleShouldOutscoreWildcardRule() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);
            AclRule exact = rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.ALLOW);
            AclRule wildcard = rule("*", "*", AccessType.ALL, Principal.USER, "u1", Permission.ALLOW);

            assertTrue(scorer.getMatchingScore(exact, request) > scorer.getMatchingScore(wildcard, request));
        }

        @Test
        @DisplayName("字段不匹配时返回 -1")
        void mismatchShouldReturnNoMatch() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);

            assertEquals(RuleScorer.NO_MATCH, scorer.getMatchingScore(
                    rule("order", "*", AccessType.ALL, Principal.USER, "u1", Permission.ALLOW), request));
            assertEquals(RuleScorer.NO_MATCH, scorer.getMatchingScore(
                    rule("account", "create", AccessType.ALL, Principal.USER, "u1", Permission.ALLOW), request));
            assertEquals(RuleScorer.NO_MATCH, scorer.getMatchingScore(
                    rule("account", "*", AccessType.WRITE, Principal.USER, "u1", Permission.ALLOW), request));
        }

        @Test
        @DisplayName("model 的权重高于 property")
        void modelShouldWeighMoreThanProperty() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);
            AclRule exactModel = rule("account", "*", AccessType.ALL, Principal.ROLE, Roles.EVERYONE, Permission.ALLOW);
            AclRule exactProperty = rule("*", "find", AccessType.READ, Principal.USER, "u1", Permission.ALLOW);

            assertTrue(scorer.getMatchingScore(exactModel, request) > scorer.getMatchingScore(exactProperty, request));
        }

        @Test
        @DisplayName("方法别名视为 property 精确匹配")
        void aliasShouldCountAsExactProperty() {
            AccessRequest request = AccessRequest.builder()
                    .model("account")
                    .property("find")
                    .accessType(AccessType.READ)
                    .methodNames(List.of("find", "list"))
                    .build();
            AclRule byAlias = rule("account", "list", AccessType.READ, Principal.USER, "u1", Permission.ALLOW);
            AclRule byName = rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.ALLOW);

            assertEquals(scorer.getMatchingScore(byName, request), scorer.getMatchingScore(byAlias, request));
        }
    }

    @Nested
    @DisplayName("accessType 覆盖关系")
    class SubsumptionTests {

        @Test
        @DisplayName("EXECUTE 覆盖 READ / WRITE / REPLICATE")
        void executeShouldSubsumeOthers() {
            assertTrue(RuleScorer.subsumes(AccessType.EXECUTE, AccessType.READ));
            assertTrue(RuleScorer.subsumes(AccessType.EXECUTE, AccessType.WRITE));
            assertTrue(RuleScorer.subsumes(AccessType.EXECUTE, AccessType.REPLICATE));
        }

        @Test
        @DisplayName("WRITE 只覆盖 REPLICATE")
        void writeShouldSubsumeReplicateOnly() {
            assertTrue(RuleScorer.subsumes(AccessType.WRITE, AccessType.REPLICATE));
            assertFalse(RuleScorer.subsumes(AccessType.WRITE, AccessType.READ));
            assertFalse(RuleScorer.subsumes(AccessType.READ, AccessType.WRITE));
        }

        @Test
        @DisplayName("EXECUTE 规则与 WRITE 请求按精确匹配计分")
        void executeRuleShouldScoreLikeExact() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.WRITE);
            AclRule execute = rule("account", "find", AccessType.EXECUTE, Principal.USER, "u1", Permission.ALLOW);
            AclRule write = rule("account", "find", AccessType.WRITE, Principal.USER, "u1", Permission.ALLOW);

            assertEquals(scorer.getMatchingScore(write, request), scorer.getMatchingScore(execute, request));
        }
    }

    @Nested
    @DisplayName("主体与权限")
    class PrincipalTests {

        @Test
        @DisplayName("字段相同时 USER 规则得分高于 ROLE 规则")
        void userShouldOutscoreRole() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);
            AclRule user = rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.ALLOW);
            AclRule role = rule("account", "find", AccessType.READ, Principal.ROLE, "admin", Permission.DENY);

            assertTrue(scorer.getMatchingScore(user, request) > scorer.getMatchingScore(role, request));
        }

        @Test
        @DisplayName("APP 介于 USER 和 ROLE 之间")
        void appShouldSitBetweenUserAndRole() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);
            int user = scorer.getMatchingScore(rule("account", "find", AccessType.READ, Principal.USER, "u1", null), request);
            int app = scorer.getMatchingScore(rule("account", "find", AccessType.READ, Principal.APPLICATION, "a1", null), request);
            int role = scorer.getMatchingScore(rule("account", "find", AccessType.READ, Principal.ROLE, "admin", null), request);

            assertTrue(user > app);
            assertTrue(app > role);
        }

        @Test
        @DisplayName("角色越强得分越高")
        void strongerRoleShouldScoreHigher() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);
            int owner = scorer.getMatchingScore(rule("account", "*", AccessType.ALL, Principal.ROLE, Roles.OWNER, Permission.ALLOW), request);
            int everyone = scorer.getMatchingScore(rule("account", "*", AccessType.ALL, Principal.ROLE, Roles.EVERYONE, Permission.ALLOW), request);

            assertTrue(owner > everyone);
        }

        @Test
        @DisplayName("完全相同的规则按权限全序裁决")
        void permissionOrderShouldBreakExactTies() {
            AccessRequest request = AccessRequest.of("account", "find", AccessType.READ);
            int deny = scorer.getMatchingScore(rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.DENY), request);
            int allow = scorer.getMatchingScore(rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.ALLOW), request);
            assertTrue(deny > allow);

            RuleScorer reversed = new RuleScorer(PermissionOrder.of(
                    Permission.DEFAULT, Permission.DENY, Permission.AUDIT, Permission.ALARM, Permission.ALLOW));
            int reversedDeny = reversed.getMatchingScore(rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.DENY), request);
            int reversedAllow = reversed.getMatchingScore(rule("account", "find", AccessType.READ, Principal.USER, "u1", Permission.ALLOW), request);
            assertTrue(reversedAllow > reversedDeny);
        }
    }
}
