package com.modelgate.core.security;

import com.modelgate.api.security.AccessToken;
import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.AclRule;
import com.modelgate.api.security.Principal;
import com.modelgate.core.model.MethodDefinition;
import com.modelgate.core.model.ModelDefinition;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 访问上下文
 * <p>
 * 把一次原始的访问问题 (谁、哪个资源、什么操作) 规整成打分所需的字段：
 * <ul>
 *     <li>主体集合：显式传入的主体 + 令牌中的用户 / 应用</li>
 *     <li>property：显式传入，否则取方法名，都没有则为通配</li>
 *     <li>accessType：显式传入，否则取方法声明，否则按方法名推断</li>
 *     <li>methodNames：方法名及其别名</li>
 * </ul>
 * </p>
 */
@Getter
@ToString(exclude = {"model", "options"})
public class AccessContext {

    public static final String DEFAULT_SCOPE = "DEFAULT";
    public static final List<String> DEFAULT_SCOPES = List.of(DEFAULT_SCOPE);

    /**
     * options 中记录授权角色的键
     */
    public static final String AUTHORIZED_ROLES = "authorizedRoles";

    private final List<Principal> principals;
    private final AccessToken accessToken;
    private final ModelDefinition model;
    private final String modelName;
    private final Object modelId;
    private final String property;
    private final String method;
    private final List<String> methodNames;
    private final AccessType accessType;
    private final List<String> requiredScopes;

    /**
     * 调用方的 options，存在时写入授权角色
     */
    private final Map<String, Object> options;

    @Builder
    private AccessContext(List<Principal> principals, AccessToken accessToken, ModelDefinition model,
                          String modelName, Object modelId, String property, String method,
                          AccessType accessType, Map<String, Object> options) {
        this.accessToken = accessToken;
        this.model = model;
        this.modelName = model != null ? model.getName() : modelName;
        this.modelId = modelId;
        this.method = method;
        this.options = options;

        List<Principal> all = new ArrayList<>();
        if (principals != null) {
            all.addAll(principals);
        }
        if (accessToken != null) {
            if (accessToken.getUserId() != null) {
                String userType = accessToken.getPrincipalType() != null ? accessToken.getPrincipalType() : Principal.USER;
                addIfAbsent(all, new Principal(userType, accessToken.getUserId()));
            }
            if (accessToken.getAppId() != null) {
                addIfAbsent(all, Principal.app(accessToken.getAppId()));
            }
        }
        this.principals = Collections.unmodifiableList(all);

        MethodDefinition definition = model != null ? model.findMethod(method) : null;
        if (definition != null) {
            this.methodNames = Collections.unmodifiableList(definition.names());
        } else if (method != null) {
            this.methodNames = List.of(method);
        } else {
            this.methodNames = Collections.emptyList();
        }

        if (property != null) {
            this.property = property;
        } else {
            this.property = method != null ? method : AclRule.ALL;
        }

        if (accessType != null) {
            this.accessType = accessType;
        } else if (definition != null && definition.getAccessType() != null) {
            this.accessType = definition.getAccessType();
        } else if (method != null) {
            this.accessType = MethodAccessTypes.of(method);
        } else {
            this.accessType = AccessType.ALL;
        }

        if (definition != null && definition.getAccessScopes() != null && !definition.getAccessScopes().isEmpty()) {
            this.requiredScopes = List.copyOf(definition.getAccessScopes());
        } else {
            this.requiredScopes = DEFAULT_SCOPES;
        }
    }

    private static void addIfAbsent(List<Principal> principals, Principal principal) {
        for (Principal p : principals) {
            if (p.matches(principal.type(), principal.id())) {
                return;
            }
        }
        principals.add(principal);
    }

    /**
     * 第一个用户类主体 (USER 或自定义用户模型)
     */
    public Principal getUser() {
        for (Principal p : principals) {
            if (Principal.USER.equals(p.type()) || p.isCustomType()) {
                return p;
            }
        }
        return null;
    }

    public Object getUserId() {
        Principal user = getUser();
        return user == null ? null : user.id();
    }

    public Object getAppId() {
        for (Principal p : principals) {
            if (Principal.APPLICATION.equals(p.type())) {
                return p.id();
            }
        }
        return null;
    }

    /**
     * 携带用户或应用主体即视为已认证
     */
    public boolean isAuthenticated() {
        return getUserId() != null || getAppId() != null;
    }

    /**
     * 令牌授权的 scope 至少覆盖一个方法所需的 scope
     * <p>
     * 没有令牌时不做 scope 限制；令牌未声明 scope 时视为只有默认 scope。
     * </p>
     */
    public boolean isScopeAllowed() {
        if (accessToken == null) {
            return true;
        }
        List<String> granted = accessToken.getScopes() == null || accessToken.getScopes().isEmpty()
                ? DEFAULT_SCOPES : accessToken.getScopes();
        for (String required : requiredScopes) {
            if (granted.contains(required)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getGrantedScopes() {
        if (accessToken == null || accessToken.getScopes() == null || accessToken.getScopes().isEmpty()) {
            return DEFAULT_SCOPES;
        }
        return accessToken.getScopes();
    }
}
