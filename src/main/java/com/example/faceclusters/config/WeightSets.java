package com.example.faceclusters.config;

/**
 * Checks on the weight sets used by the composite quality scores.
 */
public final class WeightSets {

    public static final double TOLERANCE = 1e-6;

    private WeightSets() {}

    public static double sum(double... weights) {
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }
        return total;
    }

    /**
     * @throws IllegalArgumentException if any weight is negative or the set does not sum to 1.0
     */
    public static void requireUnitSum(String name, double... weights) {
        for (double w : weights) {
            if (!(w >= 0.0)) {
                throw new IllegalArgumentException(name + " weights must be non-negative, got " + w);
            }
        }
        double total = sum(weights);
        if (Math.abs(total - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException(
                String.format("%s weights must sum to 1.0, got %.6f", name, total));
        }
    }
}
