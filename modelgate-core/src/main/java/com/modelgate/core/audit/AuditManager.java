package com.modelgate.core.audit;

import com.modelgate.api.security.AccessRequest;
import com.modelgate.api.security.Permission;
import com.modelgate.api.security.Principal;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 审计管理器 (异步非阻塞)
 * <p>
 * 记录解析结果为 AUDIT / ALARM 的访问，以及所有拒绝。
 * </p>
 */
@Slf4j
public class AuditManager {

    // 独立单线程，保证记录顺序
    private final ExecutorService auditExecutor = new ThreadPoolExecutor(
            1,
            1,
            0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(1000),
            r -> {
                Thread thread = new Thread(r, "modelgate-audit-logger");
                thread.setDaemon(true);
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Thread {} failed: {}", t.getName(), e.getMessage()));
                return thread;
            },
            new ThreadPoolExecutor.DiscardPolicy() // 队列满则丢弃，保全鉴权主流程
    );

    /**
     * 异步记录一次访问决策
     *
     * @return 记录任务；线程池已关闭时返回已完成的 future，队列已满而被丢弃的记录其 future 不会完成
     */
    public CompletableFuture<Void> asyncRecord(List<Principal> principals, AccessRequest resolved) {
        if (auditExecutor.isShutdown()) {
            log.debug("Audit executor is shut down, skip record for {}.{}", resolved.getModel(), resolved.getProperty());
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            Permission permission = resolved.getPermission();
            if (permission == Permission.ALARM) {
                log.warn("[ALARM] Principals={}, Model={}, Property={}, AccessType={}",
                        principals, resolved.getModel(), resolved.getProperty(), resolved.getAccessType());
            } else if (permission == Permission.DENY) {
                log.info("[AUDIT] DENY Principals={}, Model={}, Property={}, AccessType={}",
                        principals, resolved.getModel(), resolved.getProperty(), resolved.getAccessType());
            } else {
                log.info("[AUDIT] {} Principals={}, Model={}, Property={}, AccessType={}",
                        permission, principals, resolved.getModel(), resolved.getProperty(), resolved.getAccessType());
            }
        }, auditExecutor);
    }

    /**
     * 是否需要记录
     */
    public static boolean isAudited(Permission permission) {
        return permission == Permission.AUDIT || permission == Permission.ALARM || permission == Permission.DENY;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down Audit Executor...");
        auditExecutor.shutdown();
        try {
            if (!auditExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                auditExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            auditExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
