package com.modelgate.core.util;

import com.modelgate.api.exception.ModelGateException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * CompletableFuture 辅助方法
 * <p>
 * join 时剥掉 CompletionException 外壳，让存储等基础设施异常原样抛给调用方。
 * </p>
 */
public final class Futures {

    private Futures() {
    }

    public static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            throw unwrap(e);
        }
    }

    /**
     * 等待全部完成并按顺序收集结果；任一失败时抛出第一个失败 (按列表顺序)
     */
    public static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | CancellationException e) {
            for (CompletableFuture<T> f : futures) {
                if (f.isCompletedExceptionally()) {
                    join(f);
                }
            }
            throw unwrap(e);
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    public static RuntimeException unwrap(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new ModelGateException(cause.getMessage(), cause);
    }
}
