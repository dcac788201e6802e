package com.example.faceclusters.ai.selection;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;

/**
 * Level 3: the member closest to the centroid, quality ignored.
 */
@Component
public class CentroidProximityStrategy implements RepresentativeStrategy {

    static final Comparator<RepresentativeCandidate> CLOSEST_FIRST = Comparator
            .comparingDouble(RepresentativeCandidate::centroidDistance)
            .thenComparing(RepresentativeCandidate::observationId);

    @Override
    public SelectionLevel level() {
        return SelectionLevel.CENTROID_PROXIMITY;
    }

    @Override
    public Optional<RepresentativeChoice> select(ClusterCandidates cluster) {
        if (!cluster.centroidUsable()) {
            return Optional.empty();
        }
        return cluster.members().stream()
                .min(CLOSEST_FIRST)
                .map(c -> new RepresentativeChoice(c.observationId(), level(), c.centroidDistance(), c.quality()));
    }
}
