package com.modelgate.api.security;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 访问令牌 (只读视图)
 * 令牌的签发、校验不在本库范围内，这里只承载鉴权需要的字段。
 */
@Data
@Builder
public class AccessToken {
    private String id;
    private Object userId;
    private Object appId;

    /**
     * userId 对应的主体类型，多用户模型时为具体的用户模型名
     */
    @Builder.Default
    private String principalType = Principal.USER;

    /**
     * 令牌被授权的 scope，null 表示默认 scope
     */
    private List<String> scopes;
}
