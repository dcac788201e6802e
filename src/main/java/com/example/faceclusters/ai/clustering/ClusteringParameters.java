package com.example.faceclusters.ai.clustering;

/**
 * Parameters one clustering run actually used, with where they came from.
 */
public record ClusteringParameters(
        double eps,
        int minSamples,
        DistanceMetric metric,
        Source source,
        String rationale
) {

    public enum Source {
        DEFAULT,
        ADAPTIVE,
        COLLECTION_OVERRIDE
    }
}
