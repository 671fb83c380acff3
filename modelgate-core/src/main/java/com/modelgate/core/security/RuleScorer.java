package com.modelgate.core.security;

import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Principal;
import com.modelgate.api.security.Roles;
import com.modelgate.core.config.PermissionOrder;

/**
 * 规则打分器
 * <p>
 * 分值由高到低依次编码：
 * <ol>
 *     <li>model / property / accessType 三个字段的匹配程度，每个字段 2 位</li>
 *     <li>主体类型：USER > APP > ROLE > 其他</li>
 *     <li>角色强度，仅 ROLE 规则</li>
 *     <li>权限全序，只用于完全相同规则之间的平局裁决</li>
 * </ol>
 * 返回 -1 表示规则不适用。
 * </p>
 */
public class RuleScorer {

    public static final int NO_MATCH = -1;

    private static final int EXACT = 3;
    private static final int RULE_WILDCARD = 2;
    private static final int REQUEST_WILDCARD = 1;

    private final PermissionOrder permissionOrder;

    public RuleScorer(PermissionOrder permissionOrder) {
        this.permissionOrder = permissionOrder != null ? permissionOrder : PermissionOrder.defaults();
    }

    public int getMatchingScore(AclRule rule, AccessRequest request) {
        int score = 0;

        // model
        score = score * 4;
        int field = scoreField(valueOrAll(rule.getModel()), request.getModelOrAll());
        if (field == NO_MATCH) {
            return NO_MATCH;
        }
        score += field;

        // property (方法别名视为精确匹配)
        score = score * 4;
        String ruleProperty = valueOrAll(rule.getProperty());
        field = request.getMethodNames().contains(ruleProperty)
                ? EXACT
                : scoreField(ruleProperty, request.getPropertyOrAll());
        if (field == NO_MATCH) {
            return NO_MATCH;
        }
        score += field;

        // accessType
        score = score * 4;
        AccessType ruleType = rule.getAccessType() == null ? AccessType.ALL : rule.getAccessType();
        AccessType requestType = request.getAccessTypeOrAll();
        field = subsumes(ruleType, requestType)
                ? EXACT
                : scoreField(ruleType.value(), requestType.value());
        if (field == NO_MATCH) {
            return NO_MATCH;
        }
        score += field;

        score = score * 4 + principalWeight(rule.getPrincipalType());

        score = score * 8;
        if (Principal.ROLE.equals(rule.getPrincipalType())) {
            score += Roles.strength(rule.getPrincipalId());
        }

        Permission permission = rule.getPermission() == null ? Permission.ALLOW : rule.getPermission();
        score = score * 4 + permissionOrder.rank(permission) - 1;
        return score;
    }

    private static int scoreField(String ruleValue, String requestValue) {
        if (ruleValue.equals(requestValue)) {
            return EXACT;
        }
        if (AclRule.ALL.equals(ruleValue)) {
            return RULE_WILDCARD;
        }
        if (AclRule.ALL.equals(requestValue)) {
            return REQUEST_WILDCARD;
        }
        return NO_MATCH;
    }

    /**
     * EXECUTE 覆盖 READ / REPLICATE / WRITE；WRITE 覆盖 REPLICATE
     */
    static boolean subsumes(AccessType ruleType, AccessType requestType) {
        if (ruleType == requestType) {
            return true;
        }
        return switch (ruleType) {
            case EXECUTE -> true;
            case WRITE -> requestType == AccessType.REPLICATE;
            default -> false;
        };
    }

    private static int principalWeight(String principalType) {
        if (principalType == null) {
            return 1;
        }
        return switch (principalType) {
            case Principal.USER -> 4;
            case Principal.APPLICATION -> 3;
            case Principal.ROLE -> 2;
            default -> 1;
        };
    }

    private static String valueOrAll(String value) {
        return value == null || value.isEmpty() ? AclRule.ALL : value;
    }
}
