package com.example.faceclusters.ai.orchestrator;

/**
 * Lifecycle of one clustering run. DONE, FAILED and CANCELLED are terminal.
 */
public enum ClusterRunState {
    IDLE,
    LOADING,
    CLUSTERING,
    SCORING_CLUSTERING,
    SCORING_FACES,
    SELECTING_REPRESENTATIVES,
    PERSISTING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
