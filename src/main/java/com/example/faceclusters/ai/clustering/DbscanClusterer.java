package com.example.faceclusters.ai.clustering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * DBSCAN over embedding vectors.
 * <p>
 * A point is a core point when its eps-neighbourhood, including itself, holds at
 * least {@code minSamples} points. Clusters grow from core points in index order;
 * a border point reachable from several clusters joins the first one that reaches
 * it. Points reachable from no core point are labelled {@link #NOISE}.
 * The labelling is fully determined by the input order, eps and minSamples.
 */
@Component
public class DbscanClusterer {

    private static final Logger log = LoggerFactory.getLogger(DbscanClusterer.class);

    public static final int NOISE = -1;
    private static final int UNVISITED = -2;

    /**
     * @param points     N x D matrix, all rows the same length and finite
     * @param eps        maximum neighbour distance (inclusive)
     * @param minSamples neighbourhood size that makes a core point
     * @param metric     distance function
     * @return one label per row, {@link #NOISE} for unassigned rows
     * @throws ClusteringException if the matrix is ragged or holds non-finite values
     */
    public int[] cluster(float[][] points, double eps, int minSamples, DistanceMetric metric) {
        if (points == null) {
            throw new ClusteringException("Embedding matrix is null");
        }
        if (!(eps > 0) || Double.isInfinite(eps)) {
            throw new ClusteringException("eps must be a positive finite number, got " + eps);
        }
        if (minSamples < 1) {
            throw new ClusteringException("minSamples must be at least 1, got " + minSamples);
        }

        int n = points.length;
        if (n == 0) {
            return new int[0];
        }
        validateMatrix(points);

        int[][] neighbours = computeNeighbourhoods(points, eps, metric);

        int[] labels = new int[n];
        Arrays.fill(labels, UNVISITED);
        int nextLabel = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != UNVISITED) {
                continue;
            }
            if (neighbours[i].length < minSamples) {
                // May still be claimed later as a border point
                labels[i] = NOISE;
                continue;
            }

            int label = nextLabel++;
            labels[i] = label;
            Deque<Integer> frontier = new ArrayDeque<>();
            for (int j : neighbours[i]) {
                frontier.add(j);
            }

            while (!frontier.isEmpty()) {
                int q = frontier.poll();
                if (labels[q] == NOISE) {
                    labels[q] = label;
                }
                if (labels[q] != UNVISITED) {
                    continue;
                }
                labels[q] = label;
                if (neighbours[q].length >= minSamples) {
                    for (int j : neighbours[q]) {
                        if (labels[j] == UNVISITED || labels[j] == NOISE) {
                            frontier.add(j);
                        }
                    }
                }
            }
        }

        log.debug("DBSCAN labelled {} points into {} clusters (eps={}, minSamples={}, metric={})",
                n, nextLabel, eps, minSamples, metric);
        return labels;
    }

    private int[][] computeNeighbourhoods(float[][] points, double eps, DistanceMetric metric) {
        int n = points.length;
        int[][] neighbours = new int[n][];
        int[] buffer = new int[n];
        for (int i = 0; i < n; i++) {
            int count = 0;
            for (int j = 0; j < n; j++) {
                double d = i == j ? 0.0 : metric.distance(points[i], points[j]);
                if (Double.isNaN(d)) {
                    throw new ClusteringException("Distance between rows " + i + " and " + j + " is undefined");
                }
                if (d <= eps) {
                    buffer[count++] = j;
                }
            }
            neighbours[i] = Arrays.copyOf(buffer, count);
        }
        return neighbours;
    }

    private void validateMatrix(float[][] points) {
        int dimension = -1;
        for (int i = 0; i < points.length; i++) {
            float[] row = points[i];
            if (row == null || row.length == 0) {
                throw new ClusteringException("Row " + i + " is empty");
            }
            if (dimension < 0) {
                dimension = row.length;
            } else if (row.length != dimension) {
                throw new ClusteringException(String.format(
                        "Row %d has dimension %d, expected %d", i, row.length, dimension));
            }
            for (float v : row) {
                if (!Float.isFinite(v)) {
                    throw new ClusteringException("Row " + i + " contains a non-finite value");
                }
            }
        }
    }
}
