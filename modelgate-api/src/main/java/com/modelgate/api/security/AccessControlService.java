package com.modelgate.api.security;

import java.util.List;

/**
 * Core 提供 - 访问控制服务
 * 负责根据 ACL 规则判定主体对模型/属性/操作的访问权限。
 *
 * @author ModelGate
 */
public interface AccessControlService {

    /**
     * 检查单个主体对模型属性的访问权限。
     * <p>
     * 静态规则先行解析，静态 DENY 不可被动态规则覆盖。
     * </p>
     *
     * @param principalType 主体类型
     * @param principalId   主体 ID
     * @param model         模型名
     * @param property      属性/方法/关系名，null 视为通配
     * @param accessType    访问类型，null 视为通配
     * @return 已落定权限的访问请求
     */
    AccessRequest checkPermission(String principalType, Object principalId, String model,
                                  String property, AccessType accessType);

    /**
     * 检查访问令牌能否调用指定方法。
     *
     * @param token   访问令牌，不能为空
     * @param model   模型名
     * @param modelId 模型实例 ID，可为空
     * @param method  方法名
     * @return 是否允许
     */
    boolean checkAccessForToken(AccessToken token, String model, Object modelId, String method);

    /**
     * 从规则集中解析出最终权限
     */
    AccessRequest resolvePermission(List<AclRule> rules, AccessRequest request);

    /**
     * 计算规则与请求的匹配分，-1 表示不适用
     */
    int getMatchingScore(AclRule rule, AccessRequest request);
}
