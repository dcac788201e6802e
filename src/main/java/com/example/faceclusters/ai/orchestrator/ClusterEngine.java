package com.example.faceclusters.ai.orchestrator;

import com.example.faceclusters.ai.clustering.Centroids;
import com.example.faceclusters.ai.clustering.ClusterQualityMetrics;
import com.example.faceclusters.ai.clustering.ClusteringParameterResolver;
import com.example.faceclusters.ai.clustering.ClusteringParameters;
import com.example.faceclusters.ai.clustering.ClusteringQualityAnalyzer;
import com.example.faceclusters.ai.clustering.DbscanClusterer;
import com.example.faceclusters.ai.clustering.EmbeddingCodec;
import com.example.faceclusters.ai.clustering.PerClusterMetrics;
import com.example.faceclusters.ai.quality.FaceQualityAnalyzer;
import com.example.faceclusters.ai.quality.FaceQualityMetrics;
import com.example.faceclusters.ai.selection.ClusterCandidates;
import com.example.faceclusters.ai.selection.RepresentativeChoice;
import com.example.faceclusters.ai.selection.RepresentativeSelector;
import com.example.faceclusters.config.FaceClusteringProperties;
import com.example.faceclusters.dao.FaceClusterDao;
import com.example.faceclusters.dao.FaceObservationDao;
import com.example.faceclusters.dao.FaceStoreException;
import com.example.faceclusters.model.ClusterRunRecord;
import com.example.faceclusters.model.ClusterSet;
import com.example.faceclusters.model.FaceCluster;
import com.example.faceclusters.model.FaceObservation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs face clustering for a collection end to end:
 * load, cluster, score the clustering, score faces, pick representatives, persist.
 * <p>
 * At most one run per collection is active at a time; a second start is refused
 * with {@link DiagnosticCode#RUN_ALREADY_ACTIVE}. Everything else that goes wrong
 * during a run ends it in FAILED with a diagnostic code, and nothing is written
 * unless the run reaches PERSISTING. Cancellation is checked after loading, after
 * clustering, between clusters and before persisting.
 */
@Service
public class ClusterEngine {

    private static final Logger log = LoggerFactory.getLogger(ClusterEngine.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final FaceObservationDao observationDao;
    private final FaceClusterDao clusterDao;
    private final DbscanClusterer clusterer;
    private final ClusteringQualityAnalyzer clusteringQualityAnalyzer;
    private final FaceQualityAnalyzer faceQualityAnalyzer;
    private final RepresentativeSelector representativeSelector;
    private final ClusteringParameterResolver parameterResolver;
    private final FaceClusteringProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    private final ConcurrentMap<String, RunContext> activeRuns = new ConcurrentHashMap<>();

    public ClusterEngine(FaceObservationDao observationDao,
                         FaceClusterDao clusterDao,
                         DbscanClusterer clusterer,
                         ClusteringQualityAnalyzer clusteringQualityAnalyzer,
                         FaceQualityAnalyzer faceQualityAnalyzer,
                         RepresentativeSelector representativeSelector,
                         ClusteringParameterResolver parameterResolver,
                         FaceClusteringProperties properties,
                         ObjectMapper objectMapper,
                         @Qualifier("clusterRunExecutor") Executor executor) {
        this.observationDao = observationDao;
        this.clusterDao = clusterDao;
        this.clusterer = clusterer;
        this.clusteringQualityAnalyzer = clusteringQualityAnalyzer;
        this.faceQualityAnalyzer = faceQualityAnalyzer;
        this.representativeSelector = representativeSelector;
        this.parameterResolver = parameterResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    /**
     * Runs on the calling thread and returns the terminal result.
     *
     * @throws ClusterEngineException with RUN_ALREADY_ACTIVE or INVALID_PARAMETERS if the run cannot start
     */
    public ClusterRunResult run(String collectionId, CancellationToken token, ClusterRunListener listener) {
        RunContext context = begin(collectionId, token, listener);
        return executeAndRelease(context);
    }

    public ClusterRunHandle submit(String collectionId) {
        return submit(collectionId, ClusterRunListener.NONE);
    }

    /**
     * Schedules a run on the clustering executor and returns immediately.
     *
     * @throws ClusterEngineException with RUN_ALREADY_ACTIVE or INVALID_PARAMETERS if the run cannot start
     */
    public ClusterRunHandle submit(String collectionId, ClusterRunListener listener) {
        RunContext context = begin(collectionId, new CancellationToken(), listener);
        try {
            executor.execute(() -> {
                try {
                    executeAndRelease(context);
                } catch (Throwable t) {
                    context.future().completeExceptionally(t);
                    throw t;
                }
            });
        } catch (RejectedExecutionException e) {
            activeRuns.remove(collectionId, context);
            throw new ClusterEngineException(DiagnosticCode.UNEXPECTED,
                    "Clustering executor rejected the run for collection " + collectionId, e);
        }
        log.info("Submitted clustering run {} for collection {}", context.runId(), collectionId);
        return new ClusterRunHandle(context);
    }

    public Optional<ClusterRunHandle> activeRun(String collectionId) {
        return Optional.ofNullable(activeRuns.get(collectionId)).map(ClusterRunHandle::new);
    }

    public Optional<ClusterSet> currentClusters(String collectionId) {
        return clusterDao.findCurrent(collectionId);
    }

    public List<ClusterRunRecord> recentRuns(String collectionId, int limit) {
        return clusterDao.findRecentRuns(collectionId, limit);
    }

    private RunContext begin(String collectionId, CancellationToken token, ClusterRunListener listener) {
        if (collectionId == null || collectionId.isBlank()) {
            throw new ClusterEngineException(DiagnosticCode.INVALID_PARAMETERS, "Collection id must not be empty");
        }
        try {
            parameterResolver.validateConfigured(collectionId);
        } catch (IllegalArgumentException e) {
            throw new ClusterEngineException(DiagnosticCode.INVALID_PARAMETERS, e.getMessage(), e);
        }

        RunContext context = new RunContext(collectionId, token, listener);
        RunContext existing = activeRuns.putIfAbsent(collectionId, context);
        if (existing != null) {
            throw new ClusterEngineException(DiagnosticCode.RUN_ALREADY_ACTIVE,
                    "Clustering run " + existing.runId() + " is already active for collection " + collectionId);
        }
        return context;
    }

    // The lock is released before the result is published so a waiting caller can start the next run
    private ClusterRunResult executeAndRelease(RunContext context) {
        ClusterRunResult result;
        try {
            result = execute(context);
        } finally {
            activeRuns.remove(context.collectionId(), context);
        }
        context.future().complete(result);
        return result;
    }

    private ClusterRunResult execute(RunContext context) {
        String runId = context.runId();
        String collectionId = context.collectionId();
        log.info("Clustering run {} started for collection {}", runId, collectionId);
        try {
            ClusterRunResult result = doExecute(context);
            log.info("Clustering run {} for collection {} finished: {} clusters, {} unidentified",
                    runId, collectionId, result.clusters().size(), result.unidentifiedIds().size());
            return result;
        } catch (CancellationException e) {
            log.info("Clustering run {} for collection {} cancelled during {}", runId, collectionId, context.state());
            return context.terminate(ClusterRunState.CANCELLED, null, "Cancelled during " + context.state());
        } catch (ClusterEngineException e) {
            log.error("Clustering run {} for collection {} failed during {} [{}]: {}",
                    runId, collectionId, context.state(), e.getCode(), e.getMessage(), e);
            return context.terminate(ClusterRunState.FAILED, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Clustering run {} for collection {} failed unexpectedly during {}: {}",
                    runId, collectionId, context.state(), e.getMessage(), e);
            return context.terminate(ClusterRunState.FAILED, DiagnosticCode.UNEXPECTED, e.getMessage());
        }
    }

    private ClusterRunResult doExecute(RunContext context) {
        String collectionId = context.collectionId();
        CancellationToken token = context.token();
        token.throwIfCancellationRequested();

        // Loading
        context.transition(ClusterRunState.LOADING);
        EmbeddingSnapshot snapshot = load(context);
        token.throwIfCancellationRequested();

        if (snapshot.isEmpty()) {
            log.info("Run {}: collection {} has no usable embeddings, nothing to cluster", context.runId(), collectionId);
            return context.terminate(ClusterRunState.DONE, null, null);
        }

        ClusteringParameters parameters;
        try {
            parameters = parameterResolver.resolve(collectionId, snapshot.size());
        } catch (IllegalArgumentException e) {
            throw new ClusterEngineException(DiagnosticCode.INVALID_PARAMETERS, e.getMessage(), e);
        }
        context.setParameters(parameters);

        // Clustering
        context.transition(ClusterRunState.CLUSTERING);
        float[][] matrix = snapshot.matrix();
        int[] labels;
        try {
            labels = clusterer.cluster(matrix, parameters.eps(), parameters.minSamples(), parameters.metric());
        } catch (RuntimeException e) {
            throw new ClusterEngineException(DiagnosticCode.CLUSTERING_FAILED, "Clustering failed: " + e.getMessage(), e);
        }

        List<String> ids = new ArrayList<>(snapshot.size());
        for (FaceObservation observation : snapshot.observations()) {
            ids.add(observation.getId());
        }
        Map<Integer, String> keys = ClusterKeyAssigner.assign(labels, ids);

        Map<String, List<Integer>> rowsByKey = new LinkedHashMap<>();
        for (String key : keys.values()) {
            rowsByKey.put(key, new ArrayList<>());
        }
        List<String> unidentified = new ArrayList<>();
        for (int row = 0; row < labels.length; row++) {
            if (labels[row] < 0) {
                unidentified.add(ids.get(row));
            } else {
                rowsByKey.get(keys.get(labels[row])).add(row);
            }
        }
        context.clustered(keys.size(), unidentified.size());
        log.info("Run {}: {} clusters and {} unidentified faces from {} embeddings (eps={}, minSamples={})",
                context.runId(), keys.size(), unidentified.size(), snapshot.size(),
                parameters.eps(), parameters.minSamples());
        token.throwIfCancellationRequested();

        // ScoringClustering
        context.transition(ClusterRunState.SCORING_CLUSTERING);
        ClusterQualityMetrics quality = clusteringQualityAnalyzer.analyze(matrix, labels, parameters.metric(),
                raw -> keys.getOrDefault(raw, String.valueOf(raw)));
        context.setQualityMetrics(quality);
        log.info("Run {}: {}", context.runId(), quality);
        for (String suggestion : quality.getTuningSuggestions()) {
            log.info("Run {} tuning suggestion: {}", context.runId(), suggestion);
        }

        // ScoringFaces, one cluster at a time
        context.transition(ClusterRunState.SCORING_FACES);
        Map<String, List<FaceQualityMetrics>> qualitiesByKey = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> entry : rowsByKey.entrySet()) {
            token.throwIfCancellationRequested();
            List<FaceQualityMetrics> qualities = new ArrayList<>();
            for (int row : entry.getValue()) {
                FaceObservation observation = snapshot.observation(row);
                qualities.add(context.faceQuality(observation.getId(), () -> faceQualityAnalyzer.analyze(
                        observation.getSourceImagePath(), observation.getBoundingBox(),
                        observation.getDetectorConfidence())));
            }
            qualitiesByKey.put(entry.getKey(), qualities);
            context.clusterScored();
        }

        // SelectingRepresentatives
        context.transition(ClusterRunState.SELECTING_REPRESENTATIVES);
        List<FaceCluster> clusters = new ArrayList<>();
        int rank = 1;
        for (Map.Entry<String, List<Integer>> entry : rowsByKey.entrySet()) {
            token.throwIfCancellationRequested();
            String key = entry.getKey();
            List<Integer> rows = entry.getValue();

            List<String> memberIds = new ArrayList<>(rows.size());
            List<float[]> vectors = new ArrayList<>(rows.size());
            Set<String> photos = new HashSet<>();
            for (int row : rows) {
                FaceObservation observation = snapshot.observation(row);
                memberIds.add(observation.getId());
                vectors.add(snapshot.vector(row));
                photos.add(observation.getSourceImagePath() != null
                        ? observation.getSourceImagePath() : observation.getId());
            }

            float[] centroid = Centroids.mean(vectors);
            ClusterCandidates candidates = ClusterCandidates.of(key, memberIds, vectors,
                    qualitiesByKey.get(key), centroid, parameters.metric());
            RepresentativeChoice choice = representativeSelector.select(candidates);
            context.selected(key, choice);

            FaceCluster cluster = new FaceCluster();
            cluster.setClusterKey(key);
            cluster.setCollectionId(collectionId);
            cluster.setDisplayName(ClusterKeyAssigner.displayName(rank++));
            cluster.setMemberIds(memberIds);
            cluster.setPhotoCount(photos.size());
            cluster.setCentroid(EmbeddingCodec.encode(centroid));
            cluster.setRepresentativeId(choice.observationId());
            cluster.setRepresentativeLevel(choice.level().getLevel());
            cluster.setRepresentativeQuality(objectMapper.convertValue(choice.quality(), MAP_TYPE));
            cluster.setQualitySnapshot(qualitySnapshot(quality, key));
            clusters.add(cluster);
        }
        context.setClusters(clusters, unidentified);
        token.throwIfCancellationRequested();

        // Persisting: past this point the run is no longer cancellable
        context.transition(ClusterRunState.PERSISTING);
        ClusterSet clusterSet = new ClusterSet(collectionId, context.runId(), clusters, unidentified,
                buildRunRecord(context));
        try {
            clusterDao.replaceClusterSet(clusterSet);
        } catch (FaceStoreException | IllegalStateException e) {
            throw new ClusterEngineException(DiagnosticCode.PERSISTENCE_FAILED,
                    "Failed to persist clusters: " + e.getMessage(), e);
        }
        return context.terminate(ClusterRunState.DONE, null, null);
    }

    private EmbeddingSnapshot load(RunContext context) {
        List<FaceObservation> loaded;
        try {
            loaded = observationDao.findWithEmbeddings(context.collectionId());
        } catch (FaceStoreException | IllegalStateException e) {
            throw new ClusterEngineException(DiagnosticCode.LOAD_FAILED,
                    "Failed to load face observations: " + e.getMessage(), e);
        }

        EmbeddingSnapshot snapshot = EmbeddingSnapshot.of(loaded,
                properties.getClustering().getExpectedDimension());
        Map<String, Integer> byReason = new LinkedHashMap<>();
        snapshot.skippedByReason().forEach((reason, count) -> byReason.put(reason.name(), count));
        context.loaded(snapshot.loadedCount(), snapshot.skippedCount(), byReason);

        if (snapshot.skippedCount() > 0) {
            log.warn("Run {}: skipped {} of {} observations with unusable embeddings {}",
                    context.runId(), snapshot.skippedCount(), snapshot.loadedCount(), byReason);
        }
        return snapshot;
    }

    private Map<String, Object> qualitySnapshot(ClusterQualityMetrics quality, String key) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("overallQuality", quality.getOverallQuality());
        snapshot.put("qualityLabel", quality.getQualityLabel().name());
        PerClusterMetrics perCluster = quality.getPerClusterMetrics().get(key);
        if (perCluster != null) {
            snapshot.putAll(objectMapper.convertValue(perCluster, MAP_TYPE));
        }
        return snapshot;
    }

    private ClusterRunRecord buildRunRecord(RunContext context) {
        ClusterRunRecord record = new ClusterRunRecord();
        record.setRunId(context.runId());
        record.setCollectionId(context.collectionId());
        record.setStartedAt(context.startedAt());
        record.setFinishedAt(new Date());

        ClusteringParameters parameters = context.parameters();
        record.setEps(parameters.eps());
        record.setMinSamples(parameters.minSamples());
        record.setDistanceMetric(parameters.metric().name());
        record.setParameterSource(parameters.source().name());
        record.setParameterRationale(parameters.rationale());

        record.setObservationsLoaded(context.observationsLoaded());
        record.setObservationsSkipped(context.observationsSkipped());
        record.setSkippedByReason(new LinkedHashMap<>(context.skippedByReason()));
        record.setClusterCount(context.clustersFound());
        record.setNoiseCount(context.noiseCount());
        record.setRepresentativesByLevel(context.representativesByLevelNames());

        ClusterQualityMetrics quality = context.qualityMetrics();
        record.setQualityMetrics(objectMapper.convertValue(quality, MAP_TYPE));
        record.setTuningSuggestions(new ArrayList<>(quality.getTuningSuggestions()));
        return record;
    }
}
