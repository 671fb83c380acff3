package com.modelgate.core.config;

import com.modelgate.api.security.Permission;
import lombok.Builder;
import lombok.Value;

/**
 * ModelGate Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽 Spring Boot 或其他外部环境的差异。
 * 由各组件通过构造器持有，修改请使用 {@code toBuilder()} 生成新实例。
 * 包含：
 * 1. ACL 解析设置
 * 2. 变更追踪与复制设置
 */
@Value
@Builder(toBuilder = true)
public class ModelGateConfig {

    // ================= ACL =================

    /**
     * 模型未声明 defaultPermission 时 DEFAULT 落定的权限
     */
    @Builder.Default
    private Permission defaultPermission = Permission.ALLOW;

    /**
     * 规则打分最后一级使用的权限全序
     */
    @Builder.Default
    private PermissionOrder permissionOrder = PermissionOrder.defaults();

    /**
     * 是否存在多个用户模型
     * <p>
     * true: 令牌的 principalType 必须是具体的用户模型名
     * <p>
     * false: 只有一个 User 模型
     */
    @Builder.Default
    private boolean multipleUserModels = false;

    /**
     * 角色并发检查线程数
     */
    @Builder.Default
    private int roleCheckThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    // ================= 变更追踪 / 复制 =================

    /**
     * 复制时下载、上传、物化的分块大小，0 表示不分块
     */
    @Builder.Default
    private int replicationChunkSize = 0;

    /**
     * 一次 replicate 调用的最大尝试次数
     */
    @Builder.Default
    private int maxReplicationAttempts = 3;

    /**
     * bulkUpdate 分块大小
     */
    @Builder.Default
    private int bulkUpdateChunkSize = 100;

    /**
     * 计算 revision 与 change id 使用的摘要算法
     */
    @Builder.Default
    private String hashAlgorithm = "SHA-1";

    /**
     * rectify 出错时只记录日志不抛出
     */
    @Builder.Default
    private boolean ignoreChangeErrors = false;

    /**
     * 周期性 rectifyAll 的间隔 (毫秒)，0 或负数表示关闭
     */
    @Builder.Default
    private long changeCleanupIntervalMs = 0L;
}
