package com.example.faceclusters.ai.selection;

import com.example.faceclusters.ai.quality.FaceQualityMetrics;

/**
 * One cluster member as seen by the selection strategies.
 *
 * @param centroidDistance distance to the cluster centroid under the run's metric;
 *                         {@link Double#NaN} when the centroid is unusable
 */
public record RepresentativeCandidate(
        String observationId,
        FaceQualityMetrics quality,
        double centroidDistance
) {}
