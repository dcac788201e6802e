package com.example.faceclusters.ai.orchestrator;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a run.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Clustering run cancelled");
        }
    }
}
