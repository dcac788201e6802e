package com.example.faceclusters.ai.orchestrator;

/**
 * Receives structured progress from a run, on the run's thread.
 * Exceptions thrown by a listener are logged and ignored.
 */
public interface ClusterRunListener {

    ClusterRunListener NONE = new ClusterRunListener() {};

    default void onStateChanged(ClusterRunState from, ClusterRunState to, ClusterRunProgress progress) {}

    default void onProgress(ClusterRunProgress progress) {}
}
