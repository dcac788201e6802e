package com.example.faceclusters.ai.selection;

import com.example.faceclusters.config.FaceClusteringProperties;
import com.example.faceclusters.config.WeightSets;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Level 1: among members whose overall quality reaches the threshold, maximize
 * {@code qualityWeight * normalizedQuality + proximityWeight * normalizedProximity}.
 * <p>
 * Both terms are min-max normalized over the qualifying members; a term that is
 * constant across them counts as 1.0. Proximity is {@code 1 / (1 + distance)}.
 * A single qualifying member is picked outright. Ties go to the member closer to
 * the centroid, then to the smaller id.
 */
@Component
public class QualityWeightedStrategy implements RepresentativeStrategy {

    private final FaceClusteringProperties.Selection config;

    public QualityWeightedStrategy(FaceClusteringProperties properties) {
        this.config = properties.getSelection();
        WeightSets.requireUnitSum("Representative selection", config.getQualityWeight(), config.getProximityWeight());
    }

    @Override
    public SelectionLevel level() {
        return SelectionLevel.QUALITY_WEIGHTED;
    }

    @Override
    public Optional<RepresentativeChoice> select(ClusterCandidates cluster) {
        if (!cluster.centroidUsable()) {
            return Optional.empty();
        }

        List<RepresentativeCandidate> qualified = cluster.members().stream()
                .filter(c -> c.quality().overallQuality() >= config.getQualityThreshold())
                .collect(Collectors.toList());
        if (qualified.isEmpty()) {
            return Optional.empty();
        }
        if (qualified.size() == 1) {
            RepresentativeCandidate only = qualified.get(0);
            return Optional.of(new RepresentativeChoice(only.observationId(), level(), 1.0, only.quality()));
        }

        double minQuality = Double.MAX_VALUE, maxQuality = -Double.MAX_VALUE;
        double minProximity = Double.MAX_VALUE, maxProximity = -Double.MAX_VALUE;
        for (RepresentativeCandidate c : qualified) {
            double q = c.quality().overallQuality();
            double p = proximity(c);
            minQuality = Math.min(minQuality, q);
            maxQuality = Math.max(maxQuality, q);
            minProximity = Math.min(minProximity, p);
            maxProximity = Math.max(maxProximity, p);
        }

        RepresentativeCandidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        Comparator<RepresentativeCandidate> tieBreak = Comparator
                .comparingDouble(RepresentativeCandidate::centroidDistance)
                .thenComparing(RepresentativeCandidate::observationId);

        for (RepresentativeCandidate c : qualified) {
            double score = config.getQualityWeight() * normalize(c.quality().overallQuality(), minQuality, maxQuality)
                    + config.getProximityWeight() * normalize(proximity(c), minProximity, maxProximity);
            if (best == null || score > bestScore
                    || (score == bestScore && tieBreak.compare(c, best) < 0)) {
                best = c;
                bestScore = score;
            }
        }
        return Optional.of(new RepresentativeChoice(best.observationId(), level(), bestScore, best.quality()));
    }

    private static double proximity(RepresentativeCandidate c) {
        return 1.0 / (1.0 + c.centroidDistance());
    }

    private static double normalize(double value, double min, double max) {
        return max > min ? (value - min) / (max - min) : 1.0;
    }
}
