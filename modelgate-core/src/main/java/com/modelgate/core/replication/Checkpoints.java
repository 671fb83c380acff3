package com.modelgate.core.replication;

/**
 * 源端 / 目标端 checkpoint 对
 */
public record Checkpoints(long source, long target) {

    /**
     * 从头开始
     */
    public static final long FROM_START = -1L;

    public static Checkpoints of(long since) {
        return new Checkpoints(since, since);
    }

    public static Checkpoints fromStart() {
        return of(FROM_START);
    }
}
