package com.example.faceclusters.ai.orchestrator;

import com.example.faceclusters.ai.clustering.EmbeddingCodec;
import com.example.faceclusters.ai.clustering.MalformedEmbeddingException;
import com.example.faceclusters.model.FaceObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view of a collection's usable embeddings, taken once per run.
 * Rows are ordered by observation id so identical inputs produce identical matrices.
 */
public final class EmbeddingSnapshot {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSnapshot.class);

    private final List<FaceObservation> observations;
    private final float[][] vectors;
    private final int dimension;
    private final int loadedCount;
    private final Map<MalformedEmbeddingException.Reason, Integer> skipped;

    private EmbeddingSnapshot(List<FaceObservation> observations, float[][] vectors, int dimension,
                              int loadedCount, Map<MalformedEmbeddingException.Reason, Integer> skipped) {
        this.observations = Collections.unmodifiableList(observations);
        this.vectors = vectors;
        this.dimension = dimension;
        this.loadedCount = loadedCount;
        this.skipped = Collections.unmodifiableMap(skipped);
    }

    /**
     * Decodes and filters the loaded observations.
     *
     * @param loaded            everything the store returned for the collection
     * @param expectedDimension required vector length, or 0 to use the most common decoded length
     */
    public static EmbeddingSnapshot of(List<FaceObservation> loaded, int expectedDimension) {
        List<FaceObservation> sorted = new ArrayList<>(loaded);
        sorted.sort(Comparator.comparing(FaceObservation::getId, Comparator.nullsLast(Comparator.naturalOrder())));

        Map<MalformedEmbeddingException.Reason, Integer> skipped = new EnumMap<>(MalformedEmbeddingException.Reason.class);
        List<FaceObservation> decodedObservations = new ArrayList<>();
        List<float[]> decodedVectors = new ArrayList<>();

        for (FaceObservation observation : sorted) {
            try {
                if (observation.getId() == null || observation.getEmbedding() == null) {
                    throw new MalformedEmbeddingException(MalformedEmbeddingException.Reason.MISSING,
                            "observation has no id or no embedding");
                }
                float[] vector = EmbeddingCodec.decode(observation.getEmbedding());
                if (observation.getEmbeddingDimension() > 0 && observation.getEmbeddingDimension() != vector.length) {
                    throw new MalformedEmbeddingException(MalformedEmbeddingException.Reason.DIMENSION_MISMATCH,
                            "declared dimension " + observation.getEmbeddingDimension()
                                    + " but decoded " + vector.length);
                }
                decodedObservations.add(observation);
                decodedVectors.add(vector);
            } catch (MalformedEmbeddingException e) {
                log.warn("Skipping face {}: {}", observation.getId(), e.getMessage());
                skipped.merge(e.getReason(), 1, Integer::sum);
            }
        }

        int dimension = expectedDimension > 0 ? expectedDimension : majorityDimension(decodedVectors);

        List<FaceObservation> usable = new ArrayList<>();
        List<float[]> usableVectors = new ArrayList<>();
        for (int i = 0; i < decodedVectors.size(); i++) {
            if (decodedVectors.get(i).length == dimension) {
                usable.add(decodedObservations.get(i));
                usableVectors.add(decodedVectors.get(i));
            } else {
                log.warn("Skipping face {}: dimension {} does not match {}",
                        decodedObservations.get(i).getId(), decodedVectors.get(i).length, dimension);
                skipped.merge(MalformedEmbeddingException.Reason.DIMENSION_MISMATCH, 1, Integer::sum);
            }
        }

        return new EmbeddingSnapshot(usable, usableVectors.toArray(new float[0][]), dimension,
                loaded.size(), skipped);
    }

    // Most frequent length; ties go to the smaller dimension
    private static int majorityDimension(List<float[]> vectors) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (float[] v : vectors) {
            counts.merge(v.length, 1, Integer::sum);
        }
        int best = 0;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public int size() { return observations.size(); }

    public boolean isEmpty() { return observations.isEmpty(); }

    public FaceObservation observation(int row) { return observations.get(row); }

    public List<FaceObservation> observations() { return observations; }

    /** Row {@code row} of the matrix; callers must not modify it. */
    public float[] vector(int row) { return vectors[row]; }

    /** The matrix rows; callers must not modify them. */
    public float[][] matrix() { return vectors.clone(); }

    public int dimension() { return dimension; }

    public int loadedCount() { return loadedCount; }

    public int skippedCount() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<MalformedEmbeddingException.Reason, Integer> skippedByReason() { return skipped; }
}
