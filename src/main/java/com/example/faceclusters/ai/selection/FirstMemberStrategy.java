package com.example.faceclusters.ai.selection;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Level 4: the first listed member. Applies to any non-empty cluster.
 */
@Component
public class FirstMemberStrategy implements RepresentativeStrategy {

    @Override
    public SelectionLevel level() {
        return SelectionLevel.FIRST_MEMBER;
    }

    @Override
    public Optional<RepresentativeChoice> select(ClusterCandidates cluster) {
        return cluster.members().stream()
                .findFirst()
                .map(c -> new RepresentativeChoice(c.observationId(), level(), Double.NaN, c.quality()));
    }
}
