package com.example.faceclusters.ai.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Runs the fallback chain: strategies in ascending {@link SelectionLevel} order,
 * first non-empty answer wins.
 */
@Service
public class RepresentativeSelector {

    private static final Logger log = LoggerFactory.getLogger(RepresentativeSelector.class);

    private final List<RepresentativeStrategy> strategies;

    public RepresentativeSelector(List<RepresentativeStrategy> strategies) {
        List<RepresentativeStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingInt(s -> s.level().getLevel()));
        this.strategies = List.copyOf(ordered);
    }

    public List<RepresentativeStrategy> getStrategies() {
        return strategies;
    }

    /**
     * @throws IllegalArgumentException if the cluster has no members
     */
    public RepresentativeChoice select(ClusterCandidates cluster) {
        if (cluster.members().isEmpty()) {
            throw new IllegalArgumentException("Cluster " + cluster.clusterKey() + " has no members");
        }
        for (RepresentativeStrategy strategy : strategies) {
            Optional<RepresentativeChoice> choice = strategy.select(cluster);
            if (choice.isPresent()) {
                log.debug("Cluster {}: representative {} chosen at level {}",
                        cluster.clusterKey(), choice.get().observationId(), strategy.level().getLevel());
                return choice.get();
            }
        }
        throw new IllegalStateException("No selection strategy applied to cluster " + cluster.clusterKey());
    }
}
