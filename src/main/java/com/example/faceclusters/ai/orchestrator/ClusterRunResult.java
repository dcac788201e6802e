package com.example.faceclusters.ai.orchestrator;

import com.example.faceclusters.ai.clustering.ClusterQualityMetrics;
import com.example.faceclusters.ai.clustering.ClusteringParameters;
import com.example.faceclusters.ai.selection.RepresentativeChoice;
import com.example.faceclusters.model.FaceCluster;

import java.util.List;
import java.util.Map;

/**
 * Terminal outcome of a run.
 *
 * @param diagnosticCode set only when {@code state} is FAILED
 * @param parameters     null when the run ended before parameters were resolved
 * @param qualityMetrics null when the run ended before the clustering was scored
 * @param selections     representative choice per cluster key
 */
public record ClusterRunResult(
        String runId,
        String collectionId,
        ClusterRunState state,
        DiagnosticCode diagnosticCode,
        String diagnosticMessage,
        ClusteringParameters parameters,
        ClusterQualityMetrics qualityMetrics,
        List<FaceCluster> clusters,
        List<String> unidentifiedIds,
        Map<String, RepresentativeChoice> selections,
        ClusterRunProgress progress
) {

    public boolean isSuccessful() {
        return state == ClusterRunState.DONE;
    }
}
