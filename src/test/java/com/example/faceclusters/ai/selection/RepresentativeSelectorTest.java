package com.example.faceclusters.ai.selection;

import com.example.faceclusters.ai.clustering.Centroids;
import com.example.faceclusters.ai.clustering.DistanceMetric;
import com.example.faceclusters.ai.quality.BlurLevel;
import com.example.faceclusters.ai.quality.FaceQualityMetrics;
import com.example.faceclusters.config.FaceClusteringProperties;
import com.example.faceclusters.model.QualityLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the representative fallback chain
 */
public class RepresentativeSelectorTest {

    private RepresentativeSelector selector;

    @BeforeEach
    public void setUp() {
        FaceClusteringProperties properties = new FaceClusteringProperties();
        // Deliberately out of order; the selector sorts by level
        selector = new RepresentativeSelector(List.of(
                new FirstMemberStrategy(),
                new QualityWeightedStrategy(properties),
                new CentroidProximityStrategy(),
                new BasicThresholdStrategy(properties)));
    }

    @Test
    public void testStrategies_OrderedByLevel() {
        List<SelectionLevel> levels = new ArrayList<>();
        selector.getStrategies().forEach(s -> levels.add(s.level()));

        assertEquals(List.of(SelectionLevel.QUALITY_WEIGHTED, SelectionLevel.BASIC_THRESHOLD,
                SelectionLevel.CENTROID_PROXIMITY, SelectionLevel.FIRST_MEMBER), levels);
    }

    @Test
    public void testSelect_OneOfFivePassesQuality_PickedAtLevelOne() {
        // Given: only f3 reaches the quality threshold, and it is not the closest to the centroid
        List<String> ids = List.of("f1", "f2", "f3", "f4", "f5");
        List<float[]> vectors = List.of(v(1, 0), v(1.1f, 0), v(3, 0), v(0.9f, 0), v(1, 0.1f));
        List<FaceQualityMetrics> qualities = List.of(
                quality(30, 0.9, 50), quality(35, 0.9, 50), quality(75, 0.9, 50),
                quality(40, 0.9, 50), quality(20, 0.9, 50));

        // When
        RepresentativeChoice choice = selector.select(candidates(ids, vectors, qualities));

        // Then
        assertEquals("f3", choice.observationId(), "The only good-quality face should be chosen");
        assertEquals(SelectionLevel.QUALITY_WEIGHTED, choice.level());
        assertEquals(1.0, choice.score(), 1e-9, "A single qualifying face is picked outright");
    }

    @Test
    public void testSelect_QualityAndProximityTradeOff() {
        // Given: a is better quality, b is closer
        List<String> ids = List.of("a", "b", "c");
        List<float[]> vectors = List.of(v(0, 0), v(1, 0), v(2, 0));
        List<FaceQualityMetrics> qualities = List.of(quality(90, 0.9, 50), quality(70, 0.9, 50), quality(10, 0.9, 50));

        // When
        RepresentativeChoice choice = selector.select(candidates(ids, vectors, qualities));

        // Then: quality weighs 0.7 against 0.3 for proximity
        assertEquals("a", choice.observationId());
        assertEquals(0.7, choice.score(), 1e-9);
    }

    @Test
    public void testSelect_IdenticalCandidates_TieGoesToSmallerId() {
        // Given: both qualifying members are equally far from the centroid and equally good
        List<String> ids = List.of("z", "m");
        List<float[]> vectors = List.of(v(0, 1), v(0, -1));
        List<FaceQualityMetrics> qualities = List.of(quality(80, 0.9, 50), quality(80, 0.9, 50));

        // When
        RepresentativeChoice choice = selector.select(candidates(ids, vectors, qualities));

        // Then
        assertEquals("m", choice.observationId());
        assertEquals(SelectionLevel.QUALITY_WEIGHTED, choice.level());
    }

    @Test
    public void testSelect_NoQualityButBasicGate_LevelTwo() {
        // Given: nobody reaches quality 60; only g1 and g2 pass the confidence and size gate
        List<String> ids = List.of("g0", "g1", "g2");
        List<float[]> vectors = List.of(v(1, 0), v(3, 0), v(5, 0));
        List<FaceQualityMetrics> qualities = List.of(quality(50, 0.4, 80), quality(50, 0.9, 45), quality(50, 0.9, 45));

        // When
        RepresentativeChoice choice = selector.select(candidates(ids, vectors, qualities));

        // Then: centroid is (3, 0), g1 sits on it
        assertEquals("g1", choice.observationId());
        assertEquals(SelectionLevel.BASIC_THRESHOLD, choice.level());
        assertEquals(0.0, choice.score(), 1e-6);
    }

    @Test
    public void testSelect_NothingPassesAnyGate_ClosestToCentroid() {
        // Given
        List<String> ids = List.of("p", "q", "r");
        List<float[]> vectors = List.of(v(0, 0), v(2, 0), v(1, 0.1f));
        List<FaceQualityMetrics> qualities = List.of(quality(10, 0.3, 10), quality(10, 0.3, 10), quality(10, 0.3, 10));

        // When
        RepresentativeChoice choice = selector.select(candidates(ids, vectors, qualities));

        // Then
        assertEquals("r", choice.observationId(), "r is closest to the centroid");
        assertEquals(SelectionLevel.CENTROID_PROXIMITY, choice.level());
    }

    @Test
    public void testSelect_SingleMember_FirstMember() {
        // Given
        ClusterCandidates cluster = candidates(List.of("solo"), List.of(v(1, 1)), List.of(quality(95, 0.99, 90)));

        // When
        RepresentativeChoice choice = selector.select(cluster);

        // Then
        assertFalse(cluster.centroidUsable(), "A single member has no meaningful centroid");
        assertEquals("solo", choice.observationId());
        assertEquals(SelectionLevel.FIRST_MEMBER, choice.level());
        assertTrue(Double.isNaN(choice.score()));
    }

    @Test
    public void testSelect_ZeroCentroidUnderCosine_FirstMember() {
        // Given: opposite vectors average to zero
        ClusterCandidates cluster = ClusterCandidates.of("k", List.of("x", "y"),
                List.of(v(1, 0), v(-1, 0)), List.of(quality(90, 0.9, 90), quality(90, 0.9, 90)),
                new float[]{0f, 0f}, DistanceMetric.COSINE);

        // When
        RepresentativeChoice choice = selector.select(cluster);

        // Then
        assertEquals(SelectionLevel.FIRST_MEMBER, choice.level());
        assertEquals("x", choice.observationId());
    }

    @Test
    public void testSelect_EmptyCluster_Throws() {
        ClusterCandidates empty = new ClusterCandidates("none", List.of(), false);

        assertThrows(IllegalArgumentException.class, () -> selector.select(empty));
    }

    @Test
    public void testQualityWeights_MustSumToOne() {
        FaceClusteringProperties properties = new FaceClusteringProperties();
        properties.getSelection().setQualityWeight(0.9);

        assertThrows(IllegalArgumentException.class, () -> new QualityWeightedStrategy(properties));
    }

    private static ClusterCandidates candidates(List<String> ids, List<float[]> vectors,
                                                List<FaceQualityMetrics> qualities) {
        return ClusterCandidates.of("face_001", ids, vectors, qualities, Centroids.mean(vectors),
                DistanceMetric.EUCLIDEAN);
    }

    private static float[] v(float x, float y) {
        return new float[]{x, y};
    }

    private static FaceQualityMetrics quality(double overall, double confidence, double sizeScore) {
        return new FaceQualityMetrics(200, 70, sizeScore, 1.0, confidence, overall,
                QualityLabel.forScore(overall), BlurLevel.GOOD, overall >= 60);
    }
}
