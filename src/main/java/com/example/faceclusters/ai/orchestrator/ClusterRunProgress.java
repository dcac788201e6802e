package com.example.faceclusters.ai.orchestrator;

import com.example.faceclusters.ai.selection.SelectionLevel;

import java.util.Map;

/**
 * Point-in-time counters of a run.
 */
public record ClusterRunProgress(
        String runId,
        String collectionId,
        ClusterRunState state,
        int observationsLoaded,
        int observationsSkipped,
        int clustersFound,
        int noiseCount,
        int clustersScored,
        int facesScored,
        Map<SelectionLevel, Integer> representativesByLevel
) {

    public ClusterRunProgress {
        representativesByLevel = Map.copyOf(representativesByLevel);
    }
}
