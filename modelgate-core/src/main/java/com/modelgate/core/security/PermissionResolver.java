package com.modelgate.core.security;

import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Roles;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 权限裁决器
 * <p>
 * 规则按分值降序稳定排序后单次遍历：
 * <ol>
 *     <li>第一条适用规则确定初始权限</li>
 *     <li>同分规则：ROLE 规则仅在角色严格强于前一条时胜出；非 ROLE 规则在 accessType 与请求完全一致时胜出</li>
 *     <li>遇到更低分值即停止；非通配请求在第一条适用规则后停止</li>
 * </ol>
 * 通配 accessType 且结果仍为 DEFAULT 时，逐一解析 READ / WRITE / EXECUTE，任一 DENY 则整体 DENY。
 * DEFAULT 只在返回前落定一次。
 * </p>
 */
@Slf4j
public class PermissionResolver {

    private final RuleScorer scorer;

    public PermissionResolver(RuleScorer scorer) {
        this.scorer = scorer;
    }

    public RuleScorer getScorer() {
        return scorer;
    }

    /**
     * 解析最终权限
     *
     * @param rules             候选规则 (静态 + 动态)，不会被修改
     * @param request           访问请求
     * @param defaultPermission DEFAULT 落定的目标，null 按 ALLOW
     * @return 已落定权限的新请求
     */
    public AccessRequest resolvePermission(List<AclRule> rules, AccessRequest request, Permission defaultPermission) {
        List<ScoredRule> sorted = sort(rules, request);
        Permission permission = resolveRaw(sorted, request);

        if (request.getAccessTypeOrAll() == AccessType.ALL && permission == Permission.DEFAULT) {
            for (AccessType type : AccessType.specificTypes()) {
                AccessRequest specific = request.withAccessType(type).withPermission(Permission.DEFAULT);
                Permission typed = resolveRaw(sort(rules, specific), specific);
                if (typed == Permission.DENY) {
                    log.debug("Wildcard request {}.{} poisoned by {} DENY", request.getModel(), request.getProperty(), type);
                    permission = Permission.DENY;
                    break;
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("The following ACLs were searched for {}.{} ({}):",
                    request.getModelOrAll(), request.getPropertyOrAll(), request.getAccessTypeOrAll());
            for (ScoredRule scored : sorted) {
                log.debug("  {} with score {}", scored.rule(), scored.score());
            }
        }

        return request.withPermission(permission).settleDefaultPermission(defaultPermission);
    }

    private List<ScoredRule> sort(List<AclRule> rules, AccessRequest request) {
        List<ScoredRule> scored = new ArrayList<>(rules.size());
        for (AclRule rule : rules) {
            scored.add(new ScoredRule(rule, scorer.getMatchingScore(rule, request)));
        }
        // List.sort 是稳定排序，同分保持输入顺序
        scored.sort(Comparator.comparingInt(ScoredRule::score).reversed());
        return scored;
    }

    private Permission resolveRaw(List<ScoredRule> sorted, AccessRequest request) {
        Permission permission = Permission.DEFAULT;
        int leader = RuleScorer.NO_MATCH;
        boolean wildcard = request.isWildcard();

        for (int i = 0; i < sorted.size(); i++) {
            ScoredRule candidate = sorted.get(i);
            if (candidate.score() < 0) {
                continue;
            }
            AclRule rule = candidate.rule();
            if (leader == RuleScorer.NO_MATCH) {
                leader = candidate.score();
                permission = permissionOf(rule);
            } else if (candidate.score() == leader) {
                if (rule.isRoleRule()) {
                    String previousRole = sorted.get(i - 1).rule().getPrincipalId();
                    if (Roles.isStronger(rule.getPrincipalId(), previousRole)) {
                        permission = permissionOf(rule);
                    }
                } else if (rule.getAccessType() != null && rule.getAccessType() == request.getAccessType()) {
                    permission = permissionOf(rule);
                }
            } else {
                break;
            }

            if (!wildcard) {
                break;
            }
        }
        return permission;
    }

    private static Permission permissionOf(AclRule rule) {
        return rule.getPermission() == null ? Permission.DEFAULT : rule.getPermission();
    }

    private record ScoredRule(AclRule rule, int score) {
    }
}
