package com.example.faceclusters.ai.quality;

import com.example.faceclusters.model.QualityLabel;

/**
 * Quality assessment of one face crop.
 *
 * @param blurScore      Laplacian variance, unbounded, higher is sharper
 * @param lightingScore  0-100
 * @param sizeScore      0-100, from the face's share of the source image area
 * @param aspectRatio    bounding box width / height
 * @param confidence     detector confidence as supplied by the caller
 * @param overallQuality 0-100 weighted composite
 * @param qualityLabel   band of {@code overallQuality}
 * @param blurLevel      band of {@code blurScore}
 * @param goodQuality    every individual gate and the overall threshold passed
 */
public record FaceQualityMetrics(
        double blurScore,
        double lightingScore,
        double sizeScore,
        double aspectRatio,
        double confidence,
        double overallQuality,
        QualityLabel qualityLabel,
        BlurLevel blurLevel,
        boolean goodQuality
) {

    /**
     * Result used whenever a crop cannot be analyzed. Only the confidence survives.
     */
    public static FaceQualityMetrics unavailable(double confidence) {
        return new FaceQualityMetrics(0.0, 0.0, 0.0, 0.0, confidence, 0.0, QualityLabel.POOR,
                BlurLevel.VERY_BLURRY, false);
    }
}
