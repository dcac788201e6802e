package com.example.faceclusters.ai.selection;

import com.example.faceclusters.config.FaceClusteringProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Level 2: gate on detector confidence and size score only, then take the
 * gated member closest to the centroid.
 */
@Component
public class BasicThresholdStrategy implements RepresentativeStrategy {

    private final FaceClusteringProperties.Selection config;

    public BasicThresholdStrategy(FaceClusteringProperties properties) {
        this.config = properties.getSelection();
    }

    @Override
    public SelectionLevel level() {
        return SelectionLevel.BASIC_THRESHOLD;
    }

    @Override
    public Optional<RepresentativeChoice> select(ClusterCandidates cluster) {
        if (!cluster.centroidUsable()) {
            return Optional.empty();
        }
        return cluster.members().stream()
                .filter(c -> c.quality().confidence() >= config.getBasicMinConfidence()
                        && c.quality().sizeScore() >= config.getBasicMinSizeScore())
                .min(CentroidProximityStrategy.CLOSEST_FIRST)
                .map(c -> new RepresentativeChoice(c.observationId(), level(), c.centroidDistance(), c.quality()));
    }
}
