package com.example.faceclusters.ai.clustering;

import com.example.faceclusters.testsupport.SyntheticFaces;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DbscanClustererTest {

    private final DbscanClusterer clusterer = new DbscanClusterer();

    @Test
    public void testCluster_TwoGroupsAndOutlier_LabelsGroupsAndNoise() {
        // Given: two tight groups on a line and one far point
        float[][] points = {
                {0.0f, 0.0f}, {0.1f, 0.0f}, {0.2f, 0.0f},
                {5.0f, 0.0f}, {5.1f, 0.0f}, {5.2f, 0.0f},
                {20.0f, 20.0f}
        };

        // When
        int[] labels = clusterer.cluster(points, 0.15, 2, DistanceMetric.EUCLIDEAN);

        // Then
        assertEquals(labels[0], labels[1], "First group should share a label");
        assertEquals(labels[1], labels[2], "First group should share a label");
        assertEquals(labels[3], labels[4], "Second group should share a label");
        assertEquals(labels[4], labels[5], "Second group should share a label");
        assertNotEquals(labels[0], labels[3], "Groups should get different labels");
        assertEquals(DbscanClusterer.NOISE, labels[6], "Isolated point should be noise");
    }

    @Test
    public void testCluster_EpsIsInclusive() {
        // Given
        float[][] points = {{0.0f}, {1.0f}};

        // When
        int[] labels = clusterer.cluster(points, 1.0, 2, DistanceMetric.EUCLIDEAN);

        // Then
        assertEquals(0, labels[0], "Points exactly eps apart are neighbours");
        assertEquals(0, labels[1], "Points exactly eps apart are neighbours");
    }

    @Test
    public void testCluster_BorderPointJoinsCluster() {
        // Given: 0,1,2 are core for minSamples 3; 3 is reachable from 2 but has only two neighbours
        float[][] points = {{0.0f}, {0.5f}, {1.0f}, {1.9f}};

        // When
        int[] labels = clusterer.cluster(points, 1.0, 3, DistanceMetric.EUCLIDEAN);

        // Then
        assertTrue(Arrays.stream(labels).allMatch(l -> l == 0), "Border point should join the cluster: " + Arrays.toString(labels));
    }

    @Test
    public void testCluster_MinSamplesOne_EveryPointIsCore() {
        // Given
        float[][] points = {{0.0f}, {10.0f}, {20.0f}};

        // When
        int[] labels = clusterer.cluster(points, 1.0, 1, DistanceMetric.EUCLIDEAN);

        // Then
        assertArrayEquals(new int[]{0, 1, 2}, labels, "With minSamples 1 nothing is noise");
    }

    @Test
    public void testCluster_CosineBlobs_FindsEachBlob() {
        // Given
        float[][] points = SyntheticFaces.blobsWithNoise(7L, 3, 10, 5);

        // When
        int[] labels = clusterer.cluster(points, 0.42, 3, DistanceMetric.COSINE);

        // Then
        Set<Integer> clusterLabels = new HashSet<>();
        for (int label : labels) {
            if (label != DbscanClusterer.NOISE) {
                clusterLabels.add(label);
            }
        }
        assertEquals(3, clusterLabels.size(), "Three blobs should give three clusters");
        for (int i = 30; i < 35; i++) {
            assertEquals(DbscanClusterer.NOISE, labels[i], "Random directions should stay unassigned");
        }
    }

    @Test
    public void testCluster_SameInput_SameLabels() {
        // Given
        float[][] points = SyntheticFaces.blobsWithNoise(11L, 2, 8, 3);

        // When
        int[] first = clusterer.cluster(points, 0.42, 3, DistanceMetric.COSINE);
        int[] second = clusterer.cluster(points, 0.42, 3, DistanceMetric.COSINE);

        // Then
        assertArrayEquals(first, second, "Labelling should be deterministic");
    }

    @Test
    public void testCluster_EmptyInput_ReturnsEmpty() {
        assertEquals(0, clusterer.cluster(new float[0][], 0.4, 3, DistanceMetric.COSINE).length);
    }

    @Test
    public void testCluster_NonFiniteValue_Throws() {
        // Given
        float[][] points = {{1.0f, 0.0f}, {Float.NaN, 1.0f}};

        // When / Then
        assertThrows(ClusteringException.class,
                () -> clusterer.cluster(points, 0.4, 1, DistanceMetric.COSINE),
                "NaN in the matrix should be rejected");
    }

    @Test
    public void testCluster_RaggedMatrix_Throws() {
        float[][] points = {{1.0f, 0.0f}, {1.0f}};

        assertThrows(ClusteringException.class,
                () -> clusterer.cluster(points, 0.4, 1, DistanceMetric.EUCLIDEAN));
    }

    @Test
    public void testCluster_InvalidParameters_Throw() {
        float[][] points = {{1.0f}};

        assertThrows(ClusteringException.class, () -> clusterer.cluster(points, 0.0, 2, DistanceMetric.EUCLIDEAN));
        assertThrows(ClusteringException.class, () -> clusterer.cluster(points, 0.3, 0, DistanceMetric.EUCLIDEAN));
    }
}
