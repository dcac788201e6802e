package com.example.faceclusters.ai.quality;

import com.example.faceclusters.config.FaceClusteringProperties;
import com.example.faceclusters.config.WeightSets;
import com.example.faceclusters.model.BoundingBox;
import com.example.faceclusters.model.QualityLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/**
 * Scores the visual quality of a face inside its source photo.
 * <p>
 * Sub-scores:
 * <ul>
 *   <li>blur: variance of the 4-neighbour Laplacian over the grayscale crop (raw, not normalized)</li>
 *   <li>lighting: mean brightness window, contrast and clipped-pixel share, 0-100</li>
 *   <li>size: face area as a share of the image, stepped onto 0-100</li>
 *   <li>aspect ratio: width / height gate</li>
 * </ul>
 * A face is good quality only when it is sharp enough, its lighting sits inside the
 * acceptable window, it is large enough, its aspect ratio is plausible and the
 * overall score reaches the threshold.
 * {@link #analyze} never throws. Any load or decode problem yields
 * {@link FaceQualityMetrics#unavailable(double)} and a log line.
 */
@Service
public class FaceQualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FaceQualityAnalyzer.class);

    private final FaceClusteringProperties.Quality config;

    public FaceQualityAnalyzer(FaceClusteringProperties properties) {
        this.config = properties.getQuality();
        WeightSets.requireUnitSum("Face quality",
                config.getBlurWeight(), config.getLightingWeight(), config.getSizeWeight(),
                config.getAspectWeight(), config.getConfidenceWeight());
        WeightSets.requireUnitSum("Lighting",
                config.getBrightnessWeight(), config.getContrastWeight(), config.getExposureWeight());
    }

    public double weightSum() {
        return WeightSets.sum(config.getBlurWeight(), config.getLightingWeight(), config.getSizeWeight(),
                config.getAspectWeight(), config.getConfidenceWeight());
    }

    /**
     * @param imagePath  source photo containing the face
     * @param box        face bounding box, pixel or normalized units
     * @param confidence detector confidence in [0, 1]
     */
    public FaceQualityMetrics analyze(String imagePath, BoundingBox box, double confidence) {
        try {
            if (imagePath == null || imagePath.isBlank()) {
                log.warn("No image path given for face quality analysis");
                return FaceQualityMetrics.unavailable(confidence);
            }
            BufferedImage image = ImageIO.read(new File(imagePath));
            if (image == null) {
                log.warn("Failed to decode image: {}", imagePath);
                return FaceQualityMetrics.unavailable(confidence);
            }
            return analyze(image, box, confidence, imagePath);
        } catch (IOException e) {
            log.warn("Failed to load image {}: {}", imagePath, e.getMessage());
            return FaceQualityMetrics.unavailable(confidence);
        } catch (RuntimeException e) {
            log.error("Error analyzing face quality for {}: {}", imagePath, e.getMessage(), e);
            return FaceQualityMetrics.unavailable(confidence);
        }
    }

    /**
     * Same as {@link #analyze(String, BoundingBox, double)} for an already decoded image.
     */
    public FaceQualityMetrics analyze(BufferedImage image, BoundingBox box, double confidence) {
        try {
            return analyze(image, box, confidence, "<in-memory>");
        } catch (RuntimeException e) {
            log.error("Error analyzing in-memory face crop: {}", e.getMessage(), e);
            return FaceQualityMetrics.unavailable(confidence);
        }
    }

    private FaceQualityMetrics analyze(BufferedImage image, BoundingBox box, double confidence, String source) {
        if (box == null || box.isEmpty()) {
            log.warn("Invalid bounding box {} for {}", box, source);
            return FaceQualityMetrics.unavailable(confidence);
        }

        int imageWidth = image.getWidth();
        int imageHeight = image.getHeight();
        Rectangle crop = box.toPixels(imageWidth, imageHeight);
        if (crop.isEmpty()) {
            log.warn("Empty face crop for {} (box {})", source, box);
            return FaceQualityMetrics.unavailable(confidence);
        }

        double[][] gray = toGrayscale(image, crop);

        double blur = blurScore(gray);
        double lighting = lightingScore(gray);
        double size = sizeScore(crop.width, crop.height, imageWidth, imageHeight);
        double aspectRatio = (double) crop.width / crop.height;

        double overall = overallQuality(blur, lighting, size, aspectRatio, confidence);
        QualityLabel label = QualityLabel.forScore(overall,
                config.getExcellentMin(), config.getGoodMin(), config.getFairMin());

        return new FaceQualityMetrics(blur, lighting, size, aspectRatio, confidence,
                overall, label, blurLevel(blur), isGoodQuality(blur, lighting, size, aspectRatio, overall));
    }

    BlurLevel blurLevel(double blur) {
        if (blur < config.getBlurVeryBlurry()) {
            return BlurLevel.VERY_BLURRY;
        } else if (blur < config.getBlurModerate()) {
            return BlurLevel.MODERATE;
        } else if (blur <= config.getBlurExcellent()) {
            return BlurLevel.GOOD;
        }
        return BlurLevel.EXCELLENT;
    }

    boolean isGoodQuality(double blur, double lighting, double size, double aspectRatio, double overall) {
        return blur >= config.getBlurModerate()
                && lighting >= config.getLightingMin() && lighting <= config.getLightingMax()
                && size >= config.getSizeAdequateScore()
                && aspectRatio >= config.getAspectMin() && aspectRatio <= config.getAspectMax()
                && overall >= config.getGoodQualityThreshold();
    }

    // ITU-R BT.601 luma, the weights OpenCV uses for BGR2GRAY
    static double[][] toGrayscale(BufferedImage image, Rectangle crop) {
        double[][] gray = new double[crop.height][crop.width];
        for (int y = 0; y < crop.height; y++) {
            for (int x = 0; x < crop.width; x++) {
                int rgb = image.getRGB(crop.x + x, crop.y + y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                gray[y][x] = Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return gray;
    }

    /**
     * Variance of the Laplacian response over interior pixels. Crops thinner than
     * three pixels in either direction have no interior and score 0.
     */
    double blurScore(double[][] gray) {
        int h = gray.length;
        int w = h > 0 ? gray[0].length : 0;
        if (h < 3 || w < 3) {
            return 0.0;
        }

        double sum = 0.0;
        double sumSquares = 0.0;
        int count = 0;
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                double laplacian = gray[y - 1][x] + gray[y + 1][x] + gray[y][x - 1] + gray[y][x + 1]
                        - 4.0 * gray[y][x];
                sum += laplacian;
                sumSquares += laplacian * laplacian;
                count++;
            }
        }
        double mean = sum / count;
        return Math.max(0.0, sumSquares / count - mean * mean);
    }

    double lightingScore(double[][] gray) {
        double sum = 0.0;
        double sumSquares = 0.0;
        long clipped = 0;
        long total = 0;
        for (double[] row : gray) {
            for (double v : row) {
                sum += v;
                sumSquares += v * v;
                if (v < config.getDarkClipLevel() || v > config.getBrightClipLevel()) {
                    clipped++;
                }
                total++;
            }
        }
        if (total == 0) {
            return 0.0;
        }

        double mean = sum / total;
        double std = Math.sqrt(Math.max(0.0, sumSquares / total - mean * mean));
        double clippedRatio = (double) clipped / total;

        double brightness;
        if (mean >= config.getBrightnessMin() && mean <= config.getBrightnessMax()) {
            brightness = 100.0;
        } else if (mean < config.getBrightnessMin()) {
            brightness = Math.max(0.0, mean / config.getBrightnessMin() * 100.0);
        } else {
            brightness = Math.max(0.0, (255.0 - mean) / (255.0 - config.getBrightnessMax()) * 100.0);
        }

        double contrast = Math.min(100.0, std / config.getContrastTarget() * 100.0);

        double exposure = 100.0;
        if (clippedRatio > config.getClippingTolerance()) {
            exposure = Math.max(0.0,
                    100.0 - (clippedRatio - config.getClippingTolerance()) * config.getClippingPenalty());
        }

        return clamp(brightness * config.getBrightnessWeight()
                + contrast * config.getContrastWeight()
                + exposure * config.getExposureWeight());
    }

    /**
     * Piecewise-linear and non-decreasing in the face/image area ratio:
     * tiny 0-20, small 20-40, medium 40-70, large 70-90, above 90-100.
     */
    double sizeScore(int faceWidth, int faceHeight, int imageWidth, int imageHeight) {
        double imageArea = (double) imageWidth * imageHeight;
        if (imageArea <= 0) {
            return 0.0;
        }
        double ratio = (double) faceWidth * faceHeight / imageArea;

        double tiny = config.getSizeTiny();
        double small = config.getSizeSmall();
        double medium = config.getSizeMedium();
        double large = config.getSizeLarge();

        double score;
        if (ratio < tiny) {
            score = ratio / tiny * 20.0;
        } else if (ratio < small) {
            score = 20.0 + (ratio - tiny) / (small - tiny) * 20.0;
        } else if (ratio < medium) {
            score = 40.0 + (ratio - small) / (medium - small) * 30.0;
        } else if (ratio < large) {
            score = 70.0 + (ratio - medium) / (large - medium) * 20.0;
        } else {
            score = 90.0 + Math.min(10.0, (ratio - large) * 50.0);
        }
        return clamp(score);
    }

    double aspectScore(double aspectRatio) {
        if (aspectRatio >= config.getAspectOptimalMin() && aspectRatio <= config.getAspectOptimalMax()) {
            return 100.0;
        } else if (aspectRatio >= config.getAspectMin() && aspectRatio <= config.getAspectMax()) {
            return config.getAspectAcceptableScore();
        }
        return 0.0;
    }

    double overallQuality(double blur, double lighting, double size, double aspectRatio, double confidence) {
        double blurNormalized = Math.min(100.0, blur / config.getBlurExcellent() * 100.0);
        double confidenceNormalized = Double.isFinite(confidence) ? clamp(confidence * 100.0) : 0.0;

        double overall = blurNormalized * config.getBlurWeight()
                + lighting * config.getLightingWeight()
                + size * config.getSizeWeight()
                + aspectScore(aspectRatio) * config.getAspectWeight()
                + confidenceNormalized * config.getConfidenceWeight();
        return clamp(overall);
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
