package com.example.faceclusters.ai.quality;

/**
 * Sharpness band of a face crop's Laplacian variance.
 */
public enum BlurLevel {
    VERY_BLURRY,
    MODERATE,
    GOOD,
    EXCELLENT
}
