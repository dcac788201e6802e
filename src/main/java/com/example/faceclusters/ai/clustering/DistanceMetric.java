package com.example.faceclusters.ai.clustering;

/**
 * Distance functions over embedding vectors.
 */
public enum DistanceMetric {

    /**
     * 1 - cosine similarity, in [0, 2]. A zero-length vector is maximally
     * dissimilar to everything.
     */
    COSINE {
        @Override
        public double distance(float[] a, float[] b) {
            checkDimensions(a, b);
            double dot = 0.0;
            double normA = 0.0;
            double normB = 0.0;
            for (int i = 0; i < a.length; i++) {
                dot += (double) a[i] * b[i];
                normA += (double) a[i] * a[i];
                normB += (double) b[i] * b[i];
            }
            if (normA == 0.0 || normB == 0.0) {
                return 1.0;
            }
            double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
            // Rounding can push |similarity| slightly past 1
            similarity = Math.max(-1.0, Math.min(1.0, similarity));
            return 1.0 - similarity;
        }
    },

    EUCLIDEAN {
        @Override
        public double distance(float[] a, float[] b) {
            checkDimensions(a, b);
            double sum = 0.0;
            for (int i = 0; i < a.length; i++) {
                double d = (double) a[i] - b[i];
                sum += d * d;
            }
            return Math.sqrt(sum);
        }
    };

    public abstract double distance(float[] a, float[] b);

    private static void checkDimensions(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                String.format("Vector dimensions must match: %d vs %d", a.length, b.length));
        }
    }
}
