package com.example.faceclusters.ai.clustering;

import com.example.faceclusters.config.FaceClusteringProperties;
import com.example.faceclusters.model.QualityLabel;
import com.example.faceclusters.testsupport.SyntheticFaces;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ClusteringQualityAnalyzerTest {

    private final ClusteringQualityAnalyzer analyzer = new ClusteringQualityAnalyzer(new FaceClusteringProperties());

    @Test
    public void testWeights_SumToOne() {
        assertEquals(1.0, analyzer.weightSum(), 1e-6, "Default clustering quality weights must sum to 1");
    }

    @Test
    public void testWeights_NotSummingToOne_RejectedAtStartup() {
        // Given
        FaceClusteringProperties properties = new FaceClusteringProperties();
        properties.getClusteringQuality().setSilhouetteWeight(0.5);

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> new ClusteringQualityAnalyzer(properties));
    }

    @Test
    public void testAnalyze_TwoClustersByHand_MatchesExpectedValues() {
        // Given: {0, 1} and {10, 11} on a line
        float[][] embeddings = {{0f}, {1f}, {10f}, {11f}};
        int[] labels = {0, 0, 1, 1};

        // When
        ClusterQualityMetrics m = analyzer.analyze(embeddings, labels, DistanceMetric.EUCLIDEAN);

        // Then
        double expectedSilhouette = (9.5 / 10.5 + 8.5 / 9.5) / 2.0;
        assertEquals(expectedSilhouette, m.getSilhouetteScore(), 1e-6, "Silhouette");
        assertEquals(0.1, m.getDaviesBouldinIndex(), 1e-6, "Davies-Bouldin");
        assertEquals(0.5, m.getAvgClusterCompactness(), 1e-6, "Compactness is the mean distance to the centroid");
        assertEquals(10.0, m.getAvgClusterSeparation(), 1e-6, "Separation is the mean centroid distance");
        assertEquals(0.0, m.getNoiseRatio(), 1e-9);
        assertTrue(m.isSeparationDefined());

        double expectedOverall = ((expectedSilhouette + 1) / 2 * 100) * 0.4
                + (100 - 0.1 / 3.0 * 100) * 0.3
                + 100 * 0.2
                + (100 - 0.5 / 2.0 * 100) * 0.1;
        assertEquals(expectedOverall, m.getOverallQuality(), 1e-4, "Overall quality");
        assertEquals(QualityLabel.EXCELLENT, m.getQualityLabel());
    }

    @Test
    public void testAnalyze_AllNoise_ReportsInsufficientData() {
        // Given
        float[][] embeddings = {{1f, 0f}, {0f, 1f}, {1f, 1f}};
        int[] labels = {-1, -1, -1};

        // When
        ClusterQualityMetrics m = analyzer.analyze(embeddings, labels, DistanceMetric.COSINE);

        // Then
        assertEquals(0, m.getClusterCount(), "No clusters");
        assertEquals(1.0, m.getNoiseRatio(), 1e-9, "Everything is noise");
        assertEquals(ClusterQualityMetrics.SILHOUETTE_WORST, m.getSilhouetteScore());
        assertEquals(ClusterQualityMetrics.DAVIES_BOULDIN_UNDEFINED, m.getDaviesBouldinIndex());
        assertEquals(QualityLabel.POOR, m.getQualityLabel());
        assertEquals(0.0, m.getOverallQuality());
        assertTrue(m.getTuningSuggestions().get(0).startsWith("Insufficient data"),
                "First suggestion should flag insufficient data: " + m.getTuningSuggestions());
    }

    @Test
    public void testAnalyze_MismatchedLengths_ReportsInsufficientData() {
        // Given
        float[][] embeddings = {{1f}, {2f}};
        int[] labels = {0};

        // When
        ClusterQualityMetrics m = analyzer.analyze(embeddings, labels, DistanceMetric.EUCLIDEAN);

        // Then
        assertEquals(0, m.getClusterCount());
        assertEquals(QualityLabel.POOR, m.getQualityLabel());
    }

    @Test
    public void testAnalyze_SingleCluster_UsesSentinelsAndNoiseOnlyScore() {
        // Given: 8 clustered points and 2 noise points
        float[][] embeddings = new float[10][];
        int[] labels = new int[10];
        for (int i = 0; i < 8; i++) {
            embeddings[i] = new float[]{1f, 0.01f * i};
            labels[i] = 0;
        }
        embeddings[8] = new float[]{0f, 1f};
        embeddings[9] = new float[]{-1f, 0f};
        labels[8] = -1;
        labels[9] = -1;

        // When
        ClusterQualityMetrics m = analyzer.analyze(embeddings, labels, DistanceMetric.COSINE);

        // Then
        assertEquals(1, m.getClusterCount());
        assertFalse(m.isSeparationDefined(), "Separation needs two clusters");
        assertEquals(ClusterQualityMetrics.SILHOUETTE_UNDEFINED, m.getSilhouetteScore());
        assertEquals(ClusterQualityMetrics.DAVIES_BOULDIN_UNDEFINED, m.getDaviesBouldinIndex());
        double noiseNormalized = 100 - (0.2 / 0.30) * 100;
        assertEquals(noiseNormalized * 0.3, m.getOverallQuality(), 1e-6, "Single cluster overall is noise-only");
        assertTrue(m.getTuningSuggestions().get(0).startsWith("Only one cluster"),
                "First suggestion should flag the single cluster: " + m.getTuningSuggestions());
    }

    @Test
    public void testAnalyze_SingletonClusterMember_ScoresZeroSilhouette() {
        // Given
        float[][] embeddings = {{0f}, {1f}, {50f}};
        int[] labels = {0, 0, 1};

        // When
        ClusterQualityMetrics m = analyzer.analyze(embeddings, labels, DistanceMetric.EUCLIDEAN,
                raw -> "c" + raw);

        // Then
        assertEquals(0.0, m.getPerClusterMetrics().get("c1").silhouette(), 1e-9,
                "A point alone in its cluster has silhouette 0");
        assertEquals(0.5, m.getAvgClusterCompactness(), 1e-6, "Singletons are left out of compactness");
    }

    @Test
    public void testAnalyze_WellSeparatedBlobs_ScoresHigh() {
        // Given: 3 blobs of 10 and 5 noise points
        float[][] embeddings = SyntheticFaces.blobsWithNoise(42L, 3, 10, 5);
        int[] labels = new int[35];
        for (int i = 0; i < 35; i++) {
            labels[i] = i < 30 ? i / 10 : -1;
        }

        // When
        ClusterQualityMetrics m = analyzer.analyze(embeddings, labels, DistanceMetric.COSINE,
                raw -> String.format("face_%03d", raw + 1));

        // Then
        assertEquals(3, m.getClusterCount());
        assertEquals(Arrays.asList(10, 10, 10), m.getClusterSizes());
        assertEquals(5.0 / 35.0, m.getNoiseRatio(), 1e-9);
        assertTrue(m.getSilhouetteScore() > 0.7, "Silhouette should be excellent: " + m.getSilhouetteScore());
        assertTrue(m.getDaviesBouldinIndex() < 0.5, "Davies-Bouldin should be low: " + m.getDaviesBouldinIndex());
        assertTrue(m.getOverallQuality() >= 70.0, "Overall should be at least 70: " + m.getOverallQuality());
        assertEquals(List.of("face_001", "face_002", "face_003"), new ArrayList<>(m.getPerClusterMetrics().keySet()));
        assertEquals(QualityLabel.EXCELLENT, m.getSilhouetteLabel());
    }

    @Test
    public void testRatings_BandEdges() {
        assertEquals(QualityLabel.GOOD, analyzer.rateSilhouette(0.7), "0.7 is not above the excellent bound");
        assertEquals(QualityLabel.EXCELLENT, analyzer.rateSilhouette(0.71));
        assertEquals(QualityLabel.FAIR, analyzer.rateSilhouette(0.25));
        assertEquals(QualityLabel.POOR, analyzer.rateSilhouette(0.2499));

        assertEquals(QualityLabel.EXCELLENT, analyzer.rateDaviesBouldin(0.49));
        assertEquals(QualityLabel.GOOD, analyzer.rateDaviesBouldin(0.5));
        assertEquals(QualityLabel.FAIR, analyzer.rateDaviesBouldin(1.5));
        assertEquals(QualityLabel.POOR, analyzer.rateDaviesBouldin(1.51));

        assertEquals(NoiseLevel.ACCEPTABLE, analyzer.rateNoise(0.149));
        assertEquals(NoiseLevel.MODERATE, analyzer.rateNoise(0.15));
        assertEquals(NoiseLevel.MODERATE, analyzer.rateNoise(0.30));
        assertEquals(NoiseLevel.CONCERNING, analyzer.rateNoise(0.31));
    }

    @Test
    public void testSuggestions_ModerateNoise_OnlyNoiseSuggestion() {
        // Given
        ClusterQualityMetrics m = metrics(0.8, 0.3, 0.20, List.of(10, 10, 10), 0.8);

        // When
        List<String> suggestions = analyzer.buildSuggestions(m);

        // Then
        assertEquals(1, suggestions.size(), "Only one suggestion expected: " + suggestions);
        assertTrue(suggestions.get(0).startsWith("Moderate noise ratio"));
    }

    @Test
    public void testSuggestions_NothingToFlag_ReportsGood() {
        ClusterQualityMetrics m = metrics(0.8, 0.3, 0.0, List.of(10, 10, 10), 0.8);

        assertEquals(List.of("Clustering quality looks good. No tuning needed."), analyzer.buildSuggestions(m));
    }

    @Test
    public void testSuggestions_PoorEverything_OrderedSilhouetteThenDbThenNoise() {
        // Given
        ClusterQualityMetrics m = metrics(0.1, 2.0, 0.4, List.of(10, 10, 10), 0.1);

        // When
        List<String> suggestions = analyzer.buildSuggestions(m);

        // Then
        assertTrue(suggestions.get(0).startsWith("Low silhouette"), suggestions.toString());
        assertTrue(suggestions.get(1).startsWith("High Davies-Bouldin"), suggestions.toString());
        assertTrue(suggestions.get(2).startsWith("High noise ratio"), suggestions.toString());
        assertTrue(suggestions.get(suggestions.size() - 1).startsWith("3 clusters have poor silhouette"),
                suggestions.toString());
    }

    @Test
    public void testSuggestions_ManyNearSingletons_SuggestsOverClusteringAndMinSamples() {
        // Given: 10 clusters, 8 of them with two members, no noise
        List<Integer> sizes = new ArrayList<>(Collections.nCopies(8, 2));
        sizes.add(10);
        sizes.add(10);
        ClusterQualityMetrics m = metrics(0.8, 0.3, 0.0, sizes, 0.8);

        // When
        List<String> suggestions = analyzer.buildSuggestions(m);

        // Then
        assertTrue(suggestions.stream().anyMatch(s -> s.startsWith("Very low noise ratio")), suggestions.toString());
        assertTrue(suggestions.stream().anyMatch(s -> s.contains("raise min_samples")), suggestions.toString());
    }

    @Test
    public void testSuggestions_DominantCluster_SuggestsSmallerEps() {
        // Given
        List<Integer> sizes = new ArrayList<>(Collections.nCopies(19, 3));
        sizes.add(0, 300);
        ClusterQualityMetrics m = metrics(0.8, 0.3, 0.0, sizes, 0.8);

        // When
        List<String> suggestions = analyzer.buildSuggestions(m);

        // Then
        assertTrue(suggestions.stream().anyMatch(s -> s.startsWith("One very large cluster")), suggestions.toString());
    }

    private static ClusterQualityMetrics metrics(double silhouette, double daviesBouldin, double noiseRatio,
                                                 List<Integer> sizes, double perClusterSilhouette) {
        int clustered = sizes.stream().mapToInt(Integer::intValue).sum();
        int faceCount = (int) Math.round(clustered / (1.0 - noiseRatio));

        ClusterQualityMetrics m = new ClusterQualityMetrics();
        m.setClusterCount(sizes.size());
        m.setClusterSizes(sizes);
        m.setFaceCount(faceCount);
        m.setNoiseCount(faceCount - clustered);
        m.setNoiseRatio(noiseRatio);
        m.setSeparationDefined(true);
        m.setSilhouetteScore(silhouette);
        m.setDaviesBouldinIndex(daviesBouldin);

        Map<String, PerClusterMetrics> perCluster = new LinkedHashMap<>();
        for (int i = 0; i < sizes.size(); i++) {
            perCluster.put("c" + i, new PerClusterMetrics(sizes.get(i), perClusterSilhouette, 0.1, 1.0));
        }
        m.setPerClusterMetrics(perCluster);
        return m;
    }
}
