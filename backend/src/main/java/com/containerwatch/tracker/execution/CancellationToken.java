package com.containerwatch.tracker.execution;

import java.util.concurrent.CancellationException;

public final class CancellationToken {
    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("tracking job cancelled");
        }
    }
}
