package com.example.faceclusters.ai.clustering;

import com.example.faceclusters.config.FaceClusteringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Chooses eps and min_samples for a collection.
 * <p>
 * Precedence: per-collection override, then the size-based adaptive table when
 * {@code faces.clustering.adaptive} is on, then the global defaults. A partial
 * override only replaces the field it sets.
 */
@Component
public class ClusteringParameterResolver {

    private static final Logger log = LoggerFactory.getLogger(ClusteringParameterResolver.class);

    /** Size tier of the adaptive table; a collection falls in the first tier whose bound it does not exceed. */
    record SizeTier(int maxFaces, double eps, int minSamples, String rationale) {}

    static final List<SizeTier> ADAPTIVE_TIERS = List.of(
            new SizeTier(50, 0.42, 2, "Tiny dataset (<= 50 faces): looser clustering prevents over-fragmentation"),
            new SizeTier(200, 0.38, 2, "Small dataset (51-200 faces): slightly looser clustering"),
            new SizeTier(1000, 0.35, 2, "Medium dataset (201-1000 faces): balanced clustering"),
            new SizeTier(5000, 0.32, 3, "Large dataset (1001-5000 faces): stricter clustering prevents false merges"),
            new SizeTier(Integer.MAX_VALUE, 0.30, 3, "Extra large dataset (> 5000 faces): strict clustering for precision"));

    private final FaceClusteringProperties.Clustering config;

    public ClusteringParameterResolver(FaceClusteringProperties properties) {
        this.config = properties.getClustering();
    }

    /**
     * Checks the statically configured values for a collection before any data is loaded.
     *
     * @throws IllegalArgumentException if the default or the collection's override is out of range
     */
    public void validateConfigured(String collectionId) {
        validate(config.getEps(), config.getMinSamples(), "default");
        FaceClusteringProperties.CollectionOverride override = overrideFor(collectionId);
        if (override != null) {
            validate(override.getEps() != null ? override.getEps() : config.getEps(),
                    override.getMinSamples() != null ? override.getMinSamples() : config.getMinSamples(),
                    "override for collection " + collectionId);
        }
    }

    /**
     * @param collectionId collection being clustered
     * @param faceCount    usable embeddings in the loaded snapshot
     * @throws IllegalArgumentException if the resolved values are out of range
     */
    public ClusteringParameters resolve(String collectionId, int faceCount) {
        double eps = config.getEps();
        int minSamples = config.getMinSamples();
        ClusteringParameters.Source source = ClusteringParameters.Source.DEFAULT;
        String rationale = "Configured defaults";

        if (config.isAdaptive()) {
            SizeTier tier = tierFor(faceCount);
            eps = tier.eps();
            minSamples = tier.minSamples();
            source = ClusteringParameters.Source.ADAPTIVE;
            rationale = tier.rationale();
        }

        FaceClusteringProperties.CollectionOverride override = overrideFor(collectionId);
        if (override != null && (override.getEps() != null || override.getMinSamples() != null)) {
            if (override.getEps() != null) {
                eps = override.getEps();
            }
            if (override.getMinSamples() != null) {
                minSamples = override.getMinSamples();
            }
            source = ClusteringParameters.Source.COLLECTION_OVERRIDE;
            rationale = "Collection-specific override";
        }

        validate(eps, minSamples, source.name().toLowerCase());
        log.info("Clustering parameters for collection {} ({} faces): eps={}, minSamples={}, metric={} [{}]",
                collectionId, faceCount, eps, minSamples, config.getDistanceMetric(), rationale);
        return new ClusteringParameters(eps, minSamples, config.getDistanceMetric(), source, rationale);
    }

    static SizeTier tierFor(int faceCount) {
        for (SizeTier tier : ADAPTIVE_TIERS) {
            if (faceCount <= tier.maxFaces()) {
                return tier;
            }
        }
        return ADAPTIVE_TIERS.get(ADAPTIVE_TIERS.size() - 1);
    }

    private FaceClusteringProperties.CollectionOverride overrideFor(String collectionId) {
        if (collectionId == null || config.getCollectionOverrides() == null) {
            return null;
        }
        return config.getCollectionOverrides().get(collectionId);
    }

    private void validate(double eps, int minSamples, String origin) {
        if (!(eps >= config.getMinEps() && eps <= config.getMaxEps())) {
            throw new IllegalArgumentException(String.format(
                    "eps %.3f (%s) is outside [%.2f, %.2f]", eps, origin, config.getMinEps(), config.getMaxEps()));
        }
        if (minSamples < config.getMinMinSamples() || minSamples > config.getMaxMinSamples()) {
            throw new IllegalArgumentException(String.format(
                    "min_samples %d (%s) is outside [%d, %d]", minSamples, origin,
                    config.getMinMinSamples(), config.getMaxMinSamples()));
        }
    }
}
