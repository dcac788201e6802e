package com.example.faceclusters.ai.clustering;

/**
 * Cohesion and separation figures for one cluster.
 *
 * @param size                    member count
 * @param silhouette              mean silhouette of the members, 0 when undefined
 * @param compactness             mean member distance to the centroid
 * @param nearestCentroidDistance distance to the closest other centroid, 0 when there is none
 */
public record PerClusterMetrics(int size, double silhouette, double compactness, double nearestCentroidDistance) {
}
