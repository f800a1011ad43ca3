package com.trading.sdg.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by the orchestrator between node
 * executions.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void reset() {
        cancelled.set(false);
    }

    /**
     * @throws OperationCancelledException if cancellation was requested.
     */
    public void throwIfCancelled(String context) {
        if (cancelled.get())
            throw new OperationCancelledException("Pipeline execution was cancelled: " + context);
    }
}
