package com.example.faceclusters.ai.orchestrator;

import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a run in flight.
 */
public class ClusterRunHandle {

    private final RunContext context;

    ClusterRunHandle(RunContext context) {
        this.context = context;
    }

    public String getRunId() { return context.runId(); }

    public String getCollectionId() { return context.collectionId(); }

    public ClusterRunProgress getProgress() { return context.progress(); }

    /**
     * Requests cooperative cancellation; the run stops at its next checkpoint.
     */
    public void cancel() {
        context.token().cancel();
    }

    public boolean isCancellationRequested() {
        return context.token().isCancellationRequested();
    }

    /**
     * Completes with the terminal result. Never completes exceptionally for
     * failures the engine diagnoses; those arrive as a FAILED result.
     */
    public CompletableFuture<ClusterRunResult> getResult() {
        return context.future().copy();
    }
}
