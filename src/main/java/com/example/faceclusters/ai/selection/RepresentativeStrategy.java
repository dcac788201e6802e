package com.example.faceclusters.ai.selection;

import java.util.Optional;

/**
 * One level of the representative fallback chain.
 */
public interface RepresentativeStrategy {

    SelectionLevel level();

    /**
     * @return the chosen member, or empty when this level does not apply to the cluster
     */
    Optional<RepresentativeChoice> select(ClusterCandidates cluster);
}
