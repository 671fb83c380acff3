package com.modelgate.core.replication;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 汇总分块处理的结果与失败
 * 失败不会中断其余分块，全部尝试后由 {@link #throwIfFailed()} 抛出第一个失败，其余作为 suppressed。
 */
@Slf4j
public class ChunkAccumulator<R> {

    private final List<R> results = new ArrayList<>();
    private final List<RuntimeException> errors = new ArrayList<>();

    public void add(R result) {
        results.add(result);
    }

    public void fail(int chunkIndex, RuntimeException error) {
        log.debug("chunk {} failed: {}", chunkIndex, error.getMessage());
        errors.add(error);
    }

    public List<R> getResults() {
        return results;
    }

    public List<RuntimeException> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void throwIfFailed() {
        if (errors.isEmpty()) {
            return;
        }
        RuntimeException first = errors.get(0);
        for (int i = 1; i < errors.size(); i++) {
            if (errors.get(i) != first) {
                first.addSuppressed(errors.get(i));
            }
        }
        throw first;
    }
}
