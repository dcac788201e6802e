package com.example.faceclusters.ai.orchestrator;

import com.example.faceclusters.ai.clustering.ClusterQualityMetrics;
import com.example.faceclusters.ai.clustering.ClusteringParameters;
import com.example.faceclusters.ai.quality.FaceQualityMetrics;
import com.example.faceclusters.ai.selection.RepresentativeChoice;
import com.example.faceclusters.ai.selection.SelectionLevel;
import com.example.faceclusters.model.FaceCluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Mutable state of one run. Written only by the run's thread; progress snapshots
 * may be read from any thread.
 */
class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String runId = UUID.randomUUID().toString();
    private final String collectionId;
    private final CancellationToken token;
    private final ClusterRunListener listener;
    private final Date startedAt = new Date();
    private final CompletableFuture<ClusterRunResult> future = new CompletableFuture<>();

    // Face quality per observation id, valid for this run only
    private final Map<String, FaceQualityMetrics> faceQuality = new HashMap<>();

    private volatile ClusterRunProgress progress;
    private ClusterRunState state = ClusterRunState.IDLE;
    private int observationsLoaded;
    private int observationsSkipped;
    private final Map<String, Integer> skippedByReason = new LinkedHashMap<>();
    private int clustersFound;
    private int noiseCount;
    private int clustersScored;
    private int facesScored;
    private final Map<SelectionLevel, Integer> representativesByLevel = new EnumMap<>(SelectionLevel.class);

    private ClusteringParameters parameters;
    private ClusterQualityMetrics qualityMetrics;
    private List<FaceCluster> clusters = new ArrayList<>();
    private List<String> unidentifiedIds = new ArrayList<>();
    private final Map<String, RepresentativeChoice> selections = new LinkedHashMap<>();

    RunContext(String collectionId, CancellationToken token, ClusterRunListener listener) {
        this.collectionId = collectionId;
        this.token = token != null ? token : new CancellationToken();
        this.listener = listener != null ? listener : ClusterRunListener.NONE;
        this.progress = snapshot();
    }

    String runId() { return runId; }
    String collectionId() { return collectionId; }
    CancellationToken token() { return token; }
    Date startedAt() { return startedAt; }
    ClusterRunState state() { return state; }
    ClusterRunProgress progress() { return progress; }
    CompletableFuture<ClusterRunResult> future() { return future; }

    void transition(ClusterRunState next) {
        ClusterRunState previous = state;
        state = next;
        progress = snapshot();
        log.debug("Run {} [{}]: {} -> {}", runId, collectionId, previous, next);
        try {
            listener.onStateChanged(previous, next, progress);
        } catch (RuntimeException e) {
            log.warn("Run listener failed on state change {} -> {}: {}", previous, next, e.getMessage());
        }
    }

    private void publish() {
        progress = snapshot();
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Run listener failed on progress update: {}", e.getMessage());
        }
    }

    void loaded(int loaded, int skipped, Map<String, Integer> byReason) {
        observationsLoaded = loaded;
        observationsSkipped = skipped;
        skippedByReason.putAll(byReason);
        publish();
    }

    void clustered(int clusters, int noise) {
        clustersFound = clusters;
        noiseCount = noise;
        publish();
    }

    FaceQualityMetrics faceQuality(String observationId, Supplier<FaceQualityMetrics> analysis) {
        FaceQualityMetrics metrics = faceQuality.get(observationId);
        if (metrics == null) {
            metrics = analysis.get();
            faceQuality.put(observationId, metrics);
            facesScored++;
        }
        return metrics;
    }

    void clusterScored() {
        clustersScored++;
        publish();
    }

    void selected(String clusterKey, RepresentativeChoice choice) {
        selections.put(clusterKey, choice);
        representativesByLevel.merge(choice.level(), 1, Integer::sum);
        publish();
    }

    void setParameters(ClusteringParameters parameters) { this.parameters = parameters; }
    ClusteringParameters parameters() { return parameters; }

    void setQualityMetrics(ClusterQualityMetrics qualityMetrics) { this.qualityMetrics = qualityMetrics; }
    ClusterQualityMetrics qualityMetrics() { return qualityMetrics; }

    void setClusters(List<FaceCluster> clusters, List<String> unidentifiedIds) {
        this.clusters = clusters;
        this.unidentifiedIds = unidentifiedIds;
    }

    int observationsLoaded() { return observationsLoaded; }
    int observationsSkipped() { return observationsSkipped; }
    Map<String, Integer> skippedByReason() { return skippedByReason; }
    int clustersFound() { return clustersFound; }
    int noiseCount() { return noiseCount; }

    Map<String, Integer> representativesByLevelNames() {
        Map<String, Integer> byName = new LinkedHashMap<>();
        representativesByLevel.forEach((level, count) -> byName.put(level.name(), count));
        return byName;
    }

    /**
     * Moves to a terminal state and builds the result. Only DONE carries clusters.
     */
    ClusterRunResult terminate(ClusterRunState terminal, DiagnosticCode code, String message) {
        transition(terminal);
        boolean done = terminal == ClusterRunState.DONE;
        return new ClusterRunResult(runId, collectionId, terminal, code, message, parameters, qualityMetrics,
                done ? List.copyOf(clusters) : List.of(),
                done ? List.copyOf(unidentifiedIds) : List.of(),
                done ? Map.copyOf(selections) : Map.of(),
                progress);
    }

    private ClusterRunProgress snapshot() {
        return new ClusterRunProgress(runId, collectionId, state, observationsLoaded, observationsSkipped,
                clustersFound, noiseCount, clustersScored, facesScored, representativesByLevel);
    }
}
