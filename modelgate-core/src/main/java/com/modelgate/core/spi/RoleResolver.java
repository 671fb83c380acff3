package com.modelgate.core.spi;

import com.modelgate.core.security.AccessContext;

import java.util.concurrent.CompletableFuture;

/**
 * SPI: 角色成员判定
 * <p>
 * 每次请求都会重新求值，结果不缓存。
 * </p>
 * <p>
 * {@code resolve} 在调用方线程上执行。需要异步执行时可以使用
 * {@code RoleRegistry#getExecutor()}，该线程池大小固定 (roleCheckThreads)，
 * 其中的任务不得阻塞等待其他角色检查 (例如对 {@code isInRole(..)} 调用 {@code join()})，
 * 否则线程池耗尽后会死锁。依赖其他角色时用 {@code thenCompose} 组合返回的 future。
 * </p>
 */
@FunctionalInterface
public interface RoleResolver {

    CompletableFuture<Boolean> resolve(String roleName, AccessContext context);
}
