package com.example.faceclusters.ai.selection;

import com.example.faceclusters.ai.quality.FaceQualityMetrics;

/**
 * Outcome of representative selection for one cluster.
 *
 * @param score level-specific ranking value: the combined score at level 1, the
 *              centroid distance at levels 2 and 3, {@link Double#NaN} at level 4
 */
public record RepresentativeChoice(
        String observationId,
        SelectionLevel level,
        double score,
        FaceQualityMetrics quality
) {}
