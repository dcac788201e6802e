package com.example.faceclusters.ai.clustering;

import java.util.List;

/**
 * Mean vectors, accumulated in double precision.
 */
public final class Centroids {

    private Centroids() {}

    public static float[] mean(float[][] embeddings, int[] rows) {
        int dimension = embeddings[rows[0]].length;
        double[] sum = new double[dimension];
        for (int row : rows) {
            accumulate(sum, embeddings[row]);
        }
        return divide(sum, rows.length);
    }

    public static float[] mean(List<float[]> vectors) {
        if (vectors.isEmpty()) {
            return new float[0];
        }
        double[] sum = new double[vectors.get(0).length];
        for (float[] v : vectors) {
            accumulate(sum, v);
        }
        return divide(sum, vectors.size());
    }

    private static void accumulate(double[] sum, float[] v) {
        if (v.length != sum.length) {
            throw new IllegalArgumentException(
                String.format("Vector dimensions must match: %d vs %d", v.length, sum.length));
        }
        for (int d = 0; d < sum.length; d++) {
            sum[d] += v[d];
        }
    }

    private static float[] divide(double[] sum, int count) {
        float[] centroid = new float[sum.length];
        for (int d = 0; d < sum.length; d++) {
            centroid[d] = (float) (sum[d] / count);
        }
        return centroid;
    }
}
