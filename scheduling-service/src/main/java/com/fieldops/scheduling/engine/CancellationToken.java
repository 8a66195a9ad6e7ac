package com.fieldops.scheduling.engine;

/**
 * Cooperative cancellation flag shared between a running optimization and whoever may stop it.
 * The engine polls it before each greedy insertion and between local-search iterations.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }
}
