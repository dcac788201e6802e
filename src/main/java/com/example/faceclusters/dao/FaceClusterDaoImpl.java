package com.example.faceclusters.dao;

import com.example.faceclusters.model.ClusterRunRecord;
import com.example.faceclusters.model.ClusterSet;
import com.example.faceclusters.model.FaceCluster;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Blob;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldPath;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Firestore layout:
 * <pre>
 * face_cluster_sets/{collectionId}                                   pointer: currentGeneration
 * face_cluster_sets/{collectionId}/generations/{generationId}        set header, unidentified ids
 * face_cluster_sets/{collectionId}/generations/{generationId}/clusters/{clusterKey}
 * face_cluster_runs/{runId}                                          run audit
 * </pre>
 * A replace writes the new generation in full, then flips the pointer and writes
 * the run record in one transaction. Readers only follow the pointer, so an
 * interrupted replace leaves the previous generation current. The superseded
 * generation is deleted afterwards on a best-effort basis; readers re-check the
 * pointer to avoid returning a generation that was deleted under them.
 */
@Repository
public class FaceClusterDaoImpl implements FaceClusterDao {

    private static final Logger log = LoggerFactory.getLogger(FaceClusterDaoImpl.class);

    static final String SETS_COLLECTION = "face_cluster_sets";
    static final String GENERATIONS = "generations";
    static final String CLUSTERS = "clusters";
    static final String RUNS_COLLECTION = "face_cluster_runs";

    // Firestore caps a batch at 500 writes
    static final int MAX_BATCH_WRITES = 500;

    static final int MAX_READ_ATTEMPTS = 3;

    @Autowired(required = false)
    private Firestore db;

    private void checkFirestore() {
        if (db == null) {
            throw new IllegalStateException("Firestore is not available in development mode. Please configure Firebase credentials.");
        }
    }

    @Override
    public void replaceClusterSet(ClusterSet clusterSet) {
        checkFirestore();
        String collectionId = clusterSet.getCollectionId();
        String generationId = clusterSet.getGenerationId();
        DocumentReference pointerRef = db.collection(SETS_COLLECTION).document(collectionId);
        DocumentReference generationRef = pointerRef.collection(GENERATIONS).document(generationId);

        String previousGeneration;
        try {
            writeGeneration(generationRef, clusterSet);

            DocumentReference runRef = db.collection(RUNS_COLLECTION).document(clusterSet.getRun().getRunId());
            previousGeneration = db.runTransaction(transaction -> {
                DocumentSnapshot pointer = transaction.get(pointerRef).get();
                String previous = pointer.exists() ? pointer.getString("currentGeneration") : null;

                Map<String, Object> pointerData = new HashMap<>();
                pointerData.put("collectionId", collectionId);
                pointerData.put("currentGeneration", generationId);
                pointerData.put("clusterCount", clusterSet.getClusters().size());
                pointerData.put("updatedAt", new Date());
                transaction.set(pointerRef, pointerData);
                transaction.set(runRef, runToMap(clusterSet.getRun()));
                return previous;
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            discardGeneration(generationRef);
            throw new FaceStoreException("Interrupted while replacing clusters for " + collectionId, e);
        } catch (ExecutionException | RuntimeException e) {
            discardGeneration(generationRef);
            throw new FaceStoreException("Failed to replace clusters for " + collectionId, e);
        }

        log.info("Collection {} now points at cluster generation {} ({} clusters)",
                collectionId, generationId, clusterSet.getClusters().size());

        if (previousGeneration != null && !previousGeneration.equals(generationId)) {
            discardGeneration(pointerRef.collection(GENERATIONS).document(previousGeneration));
        }
    }

    private void writeGeneration(DocumentReference generationRef, ClusterSet clusterSet)
            throws ExecutionException, InterruptedException {
        WriteBatch batch = db.batch();
        int writes = 0;

        Map<String, Object> header = new HashMap<>();
        header.put("collectionId", clusterSet.getCollectionId());
        header.put("generationId", clusterSet.getGenerationId());
        header.put("createdAt", clusterSet.getCreatedAt());
        header.put("clusterCount", clusterSet.getClusters().size());
        header.put("unidentifiedIds", clusterSet.getUnidentifiedIds());
        header.put("runId", clusterSet.getRun().getRunId());
        batch.set(generationRef, header);
        writes++;

        CollectionReference clusters = generationRef.collection(CLUSTERS);
        for (FaceCluster cluster : clusterSet.getClusters()) {
            if (writes == MAX_BATCH_WRITES) {
                batch.commit().get();
                batch = db.batch();
                writes = 0;
            }
            batch.set(clusters.document(cluster.getClusterKey()), clusterToMap(cluster));
            writes++;
        }
        batch.commit().get();
    }

    /**
     * Deletes a generation that is not (or no longer) current. Failures are logged:
     * an orphaned generation is unreachable through the pointer.
     */
    private void discardGeneration(DocumentReference generationRef) {
        try {
            List<QueryDocumentSnapshot> clusterDocs = generationRef.collection(CLUSTERS).get().get().getDocuments();
            WriteBatch batch = db.batch();
            int writes = 0;
            for (QueryDocumentSnapshot doc : clusterDocs) {
                if (writes == MAX_BATCH_WRITES) {
                    batch.commit().get();
                    batch = db.batch();
                    writes = 0;
                }
                batch.delete(doc.getReference());
                writes++;
            }
            batch.delete(generationRef);
            batch.commit().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while deleting cluster generation {}", generationRef.getPath());
        } catch (ExecutionException | RuntimeException e) {
            log.warn("Failed to delete cluster generation {}: {}", generationRef.getPath(), e.getMessage());
        }
    }

    /**
     * Follows the pointer, reads that generation, then reads the pointer again. A
     * generation is only deleted after the pointer has moved off it, so an unchanged
     * pointer means the clusters were read in full. Otherwise the read is retried.
     */
    @Override
    public Optional<ClusterSet> findCurrent(String collectionId) {
        checkFirestore();
        DocumentReference pointerRef = db.collection(SETS_COLLECTION).document(collectionId);
        try {
            for (int attempt = 1; attempt <= MAX_READ_ATTEMPTS; attempt++) {
                String generationId = currentGeneration(pointerRef);
                if (generationId == null) {
                    return Optional.empty();
                }
                Optional<ClusterSet> set = readGeneration(collectionId, pointerRef, generationId);
                if (generationId.equals(currentGeneration(pointerRef))) {
                    if (set.isEmpty()) {
                        log.warn("Collection {} points at missing generation {}", collectionId, generationId);
                    }
                    return set;
                }
                log.info("Cluster generation of {} moved while reading {} (attempt {}/{})",
                        collectionId, generationId, attempt, MAX_READ_ATTEMPTS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FaceStoreException("Interrupted while reading clusters for " + collectionId, e);
        } catch (ExecutionException e) {
            throw new FaceStoreException("Failed to read clusters for " + collectionId, e);
        }
        throw new FaceStoreException("Clusters for " + collectionId + " kept changing while being read");
    }

    private String currentGeneration(DocumentReference pointerRef) throws ExecutionException, InterruptedException {
        DocumentSnapshot pointer = pointerRef.get().get();
        return pointer.exists() ? pointer.getString("currentGeneration") : null;
    }

    private Optional<ClusterSet> readGeneration(String collectionId, DocumentReference pointerRef, String generationId)
            throws ExecutionException, InterruptedException {
        DocumentReference generationRef = pointerRef.collection(GENERATIONS).document(generationId);
        DocumentSnapshot header = generationRef.get().get();
        if (!header.exists()) {
            return Optional.empty();
        }

        List<FaceCluster> clusters = new ArrayList<>();
        for (QueryDocumentSnapshot doc : generationRef.collection(CLUSTERS)
                .orderBy(FieldPath.documentId()).get().get().getDocuments()) {
            clusters.add(documentToCluster(doc.getId(), doc.getData()));
        }

        ClusterSet set = new ClusterSet();
        set.setCollectionId(collectionId);
        set.setGenerationId(generationId);
        set.setCreatedAt(header.getDate("createdAt"));
        set.setClusters(clusters);
        set.setUnidentifiedIds(stringList(header.get("unidentifiedIds")));

        String runId = header.getString("runId");
        if (runId != null) {
            DocumentSnapshot run = db.collection(RUNS_COLLECTION).document(runId).get().get();
            if (run.exists()) {
                set.setRun(documentToRun(run.getData()));
            }
        }
        return Optional.of(set);
    }

    @Override
    public List<ClusterRunRecord> findRecentRuns(String collectionId, int limit) {
        checkFirestore();
        try {
            List<ClusterRunRecord> runs = new ArrayList<>();
            for (QueryDocumentSnapshot doc : db.collection(RUNS_COLLECTION)
                    .whereEqualTo("collectionId", collectionId)
                    .orderBy("startedAt", Query.Direction.DESCENDING)
                    .limit(limit)
                    .get()
                    .get()
                    .getDocuments()) {
                runs.add(documentToRun(doc.getData()));
            }
            return runs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FaceStoreException("Interrupted while reading cluster runs for " + collectionId, e);
        } catch (ExecutionException e) {
            throw new FaceStoreException("Failed to read cluster runs for " + collectionId, e);
        }
    }

    static Map<String, Object> clusterToMap(FaceCluster cluster) {
        Map<String, Object> data = new HashMap<>();
        data.put("clusterKey", cluster.getClusterKey());
        data.put("collectionId", cluster.getCollectionId());
        data.put("displayName", cluster.getDisplayName());
        data.put("memberIds", cluster.getMemberIds());
        data.put("photoCount", cluster.getPhotoCount());
        data.put("centroid", cluster.getCentroid() != null ? Blob.fromBytes(cluster.getCentroid()) : null);
        data.put("representativeId", cluster.getRepresentativeId());
        data.put("representativeLevel", cluster.getRepresentativeLevel());
        data.put("representativeQuality", cluster.getRepresentativeQuality());
        data.put("qualitySnapshot", cluster.getQualitySnapshot());
        return data;
    }

    @SuppressWarnings("unchecked")
    static FaceCluster documentToCluster(String clusterKey, Map<String, Object> data) {
        FaceCluster cluster = new FaceCluster();
        cluster.setClusterKey(clusterKey);
        cluster.setCollectionId((String) data.get("collectionId"));
        cluster.setDisplayName((String) data.get("displayName"));
        cluster.setMemberIds(stringList(data.get("memberIds")));
        cluster.setPhotoCount(asInt(data.get("photoCount")));
        if (data.get("centroid") instanceof Blob blob) {
            cluster.setCentroid(blob.toBytes());
        }
        cluster.setRepresentativeId((String) data.get("representativeId"));
        cluster.setRepresentativeLevel(asInt(data.get("representativeLevel")));
        if (data.get("representativeQuality") instanceof Map<?, ?> quality) {
            cluster.setRepresentativeQuality(new LinkedHashMap<>((Map<String, Object>) quality));
        }
        if (data.get("qualitySnapshot") instanceof Map<?, ?> snapshot) {
            cluster.setQualitySnapshot(new LinkedHashMap<>((Map<String, Object>) snapshot));
        }
        return cluster;
    }

    static Map<String, Object> runToMap(ClusterRunRecord run) {
        Map<String, Object> data = new HashMap<>();
        data.put("runId", run.getRunId());
        data.put("collectionId", run.getCollectionId());
        data.put("startedAt", run.getStartedAt());
        data.put("finishedAt", run.getFinishedAt());
        data.put("eps", run.getEps());
        data.put("minSamples", run.getMinSamples());
        data.put("distanceMetric", run.getDistanceMetric());
        data.put("parameterSource", run.getParameterSource());
        data.put("parameterRationale", run.getParameterRationale());
        data.put("observationsLoaded", run.getObservationsLoaded());
        data.put("observationsSkipped", run.getObservationsSkipped());
        data.put("skippedByReason", run.getSkippedByReason());
        data.put("clusterCount", run.getClusterCount());
        data.put("noiseCount", run.getNoiseCount());
        data.put("representativesByLevel", run.getRepresentativesByLevel());
        data.put("qualityMetrics", run.getQualityMetrics());
        data.put("tuningSuggestions", run.getTuningSuggestions());
        return data;
    }

    @SuppressWarnings("unchecked")
    static ClusterRunRecord documentToRun(Map<String, Object> data) {
        ClusterRunRecord run = new ClusterRunRecord();
        run.setRunId((String) data.get("runId"));
        run.setCollectionId((String) data.get("collectionId"));
        run.setStartedAt(asDate(data.get("startedAt")));
        run.setFinishedAt(asDate(data.get("finishedAt")));
        run.setEps(data.get("eps") instanceof Number n ? n.doubleValue() : 0.0);
        run.setMinSamples(asInt(data.get("minSamples")));
        run.setDistanceMetric((String) data.get("distanceMetric"));
        run.setParameterSource((String) data.get("parameterSource"));
        run.setParameterRationale((String) data.get("parameterRationale"));
        run.setObservationsLoaded(asInt(data.get("observationsLoaded")));
        run.setObservationsSkipped(asInt(data.get("observationsSkipped")));
        run.setSkippedByReason(intMap(data.get("skippedByReason")));
        run.setClusterCount(asInt(data.get("clusterCount")));
        run.setNoiseCount(asInt(data.get("noiseCount")));
        run.setRepresentativesByLevel(intMap(data.get("representativesByLevel")));
        if (data.get("qualityMetrics") instanceof Map<?, ?> metrics) {
            run.setQualityMetrics(new LinkedHashMap<>((Map<String, Object>) metrics));
        }
        run.setTuningSuggestions(stringList(data.get("tuningSuggestions")));
        return run;
    }

    private static List<String> stringList(Object raw) {
        List<String> values = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s) {
                    values.add(s);
                }
            }
        }
        return values;
    }

    private static Map<String, Integer> intMap(Object raw) {
        Map<String, Integer> values = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                values.put(String.valueOf(entry.getKey()), asInt(entry.getValue()));
            }
        }
        return values;
    }

    private static int asInt(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }

    private static Date asDate(Object value) {
        if (value instanceof Timestamp timestamp) {
            return timestamp.toDate();
        }
        return value instanceof Date date ? date : null;
    }
}
