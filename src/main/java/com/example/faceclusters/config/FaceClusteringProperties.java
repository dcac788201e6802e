package com.example.faceclusters.config;

import com.example.faceclusters.ai.clustering.DistanceMetric;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Tunables for the face clustering engine, bound from {@code faces.*}.
 * Every numeric threshold used by the analyzers and the representative
 * selection lives here so it can be overridden per deployment.
 */
@Configuration
@ConfigurationProperties(prefix = "faces")
public class FaceClusteringProperties {

    private Clustering clustering = new Clustering();
    private Quality quality = new Quality();
    private ClusteringQuality clusteringQuality = new ClusteringQuality();
    private Selection selection = new Selection();
    private Executor executor = new Executor();

    public Clustering getClustering() { return clustering; }
    public void setClustering(Clustering clustering) { this.clustering = clustering; }

    public Quality getQuality() { return quality; }
    public void setQuality(Quality quality) { this.quality = quality; }

    public ClusteringQuality getClusteringQuality() { return clusteringQuality; }
    public void setClusteringQuality(ClusteringQuality clusteringQuality) { this.clusteringQuality = clusteringQuality; }

    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    /**
     * Density clustering parameters.
     */
    public static class Clustering {
        private double eps = 0.42;
        private int minSamples = 3;
        private DistanceMetric distanceMetric = DistanceMetric.COSINE;
        private boolean adaptive = false;
        private int expectedDimension = 0;
        private double minEps = 0.20;
        private double maxEps = 0.50;
        private int minMinSamples = 1;
        private int maxMinSamples = 10;
        private Map<String, CollectionOverride> collectionOverrides = new HashMap<>();

        public double getEps() { return eps; }
        public void setEps(double eps) { this.eps = eps; }

        public int getMinSamples() { return minSamples; }
        public void setMinSamples(int minSamples) { this.minSamples = minSamples; }

        public DistanceMetric getDistanceMetric() { return distanceMetric; }
        public void setDistanceMetric(DistanceMetric distanceMetric) { this.distanceMetric = distanceMetric; }

        public boolean isAdaptive() { return adaptive; }
        public void setAdaptive(boolean adaptive) { this.adaptive = adaptive; }

        public int getExpectedDimension() { return expectedDimension; }
        public void setExpectedDimension(int expectedDimension) { this.expectedDimension = expectedDimension; }

        public double getMinEps() { return minEps; }
        public void setMinEps(double minEps) { this.minEps = minEps; }

        public double getMaxEps() { return maxEps; }
        public void setMaxEps(double maxEps) { this.maxEps = maxEps; }

        public int getMinMinSamples() { return minMinSamples; }
        public void setMinMinSamples(int minMinSamples) { this.minMinSamples = minMinSamples; }

        public int getMaxMinSamples() { return maxMinSamples; }
        public void setMaxMinSamples(int maxMinSamples) { this.maxMinSamples = maxMinSamples; }

        public Map<String, CollectionOverride> getCollectionOverrides() { return collectionOverrides; }
        public void setCollectionOverrides(Map<String, CollectionOverride> collectionOverrides) { this.collectionOverrides = collectionOverrides; }
    }

    /**
     * Per-collection clustering override; unset fields fall back to the global values.
     */
    public static class CollectionOverride {
        private Double eps;
        private Integer minSamples;

        public Double getEps() { return eps; }
        public void setEps(Double eps) { this.eps = eps; }

        public Integer getMinSamples() { return minSamples; }
        public void setMinSamples(Integer minSamples) { this.minSamples = minSamples; }
    }

    /**
     * Face crop quality thresholds and weights.
     */
    public static class Quality {
        // Laplacian variance bands
        private double blurVeryBlurry = 50.0;
        private double blurModerate = 100.0;
        private double blurExcellent = 500.0;

        // Lighting
        private double brightnessMin = 80.0;
        private double brightnessMax = 170.0;
        private double contrastTarget = 50.0;
        private int darkClipLevel = 10;
        private int brightClipLevel = 245;
        private double clippingTolerance = 0.05;
        private double clippingPenalty = 200.0;
        private double brightnessWeight = 0.4;
        private double contrastWeight = 0.3;
        private double exposureWeight = 0.3;
        private double lightingMin = 40.0;
        private double lightingMax = 90.0;

        // Face area as a fraction of the image
        private double sizeTiny = 0.01;
        private double sizeSmall = 0.02;
        private double sizeMedium = 0.05;
        private double sizeLarge = 0.20;
        private double sizeAdequateScore = 40.0;

        // Aspect ratio gate
        private double aspectMin = 0.5;
        private double aspectMax = 1.6;
        private double aspectOptimalMin = 0.8;
        private double aspectOptimalMax = 1.2;
        private double aspectAcceptableScore = 70.0;

        // Overall composite
        private double blurWeight = 0.30;
        private double lightingWeight = 0.25;
        private double sizeWeight = 0.20;
        private double aspectWeight = 0.10;
        private double confidenceWeight = 0.15;
        private double goodQualityThreshold = 60.0;

        // Label bands
        private double excellentMin = 80.0;
        private double goodMin = 60.0;
        private double fairMin = 40.0;

        public double getBlurVeryBlurry() { return blurVeryBlurry; }
        public void setBlurVeryBlurry(double blurVeryBlurry) { this.blurVeryBlurry = blurVeryBlurry; }

        public double getBlurModerate() { return blurModerate; }
        public void setBlurModerate(double blurModerate) { this.blurModerate = blurModerate; }

        public double getBlurExcellent() { return blurExcellent; }
        public void setBlurExcellent(double blurExcellent) { this.blurExcellent = blurExcellent; }

        public double getBrightnessMin() { return brightnessMin; }
        public void setBrightnessMin(double brightnessMin) { this.brightnessMin = brightnessMin; }

        public double getBrightnessMax() { return brightnessMax; }
        public void setBrightnessMax(double brightnessMax) { this.brightnessMax = brightnessMax; }

        public double getContrastTarget() { return contrastTarget; }
        public void setContrastTarget(double contrastTarget) { this.contrastTarget = contrastTarget; }

        public int getDarkClipLevel() { return darkClipLevel; }
        public void setDarkClipLevel(int darkClipLevel) { this.darkClipLevel = darkClipLevel; }

        public int getBrightClipLevel() { return brightClipLevel; }
        public void setBrightClipLevel(int brightClipLevel) { this.brightClipLevel = brightClipLevel; }

        public double getClippingTolerance() { return clippingTolerance; }
        public void setClippingTolerance(double clippingTolerance) { this.clippingTolerance = clippingTolerance; }

        public double getClippingPenalty() { return clippingPenalty; }
        public void setClippingPenalty(double clippingPenalty) { this.clippingPenalty = clippingPenalty; }

        public double getBrightnessWeight() { return brightnessWeight; }
        public void setBrightnessWeight(double brightnessWeight) { this.brightnessWeight = brightnessWeight; }

        public double getContrastWeight() { return contrastWeight; }
        public void setContrastWeight(double contrastWeight) { this.contrastWeight = contrastWeight; }

        public double getExposureWeight() { return exposureWeight; }
        public void setExposureWeight(double exposureWeight) { this.exposureWeight = exposureWeight; }

        public double getLightingMin() { return lightingMin; }
        public void setLightingMin(double lightingMin) { this.lightingMin = lightingMin; }

        public double getLightingMax() { return lightingMax; }
        public void setLightingMax(double lightingMax) { this.lightingMax = lightingMax; }

        public double getSizeTiny() { return sizeTiny; }
        public void setSizeTiny(double sizeTiny) { this.sizeTiny = sizeTiny; }

        public double getSizeSmall() { return sizeSmall; }
        public void setSizeSmall(double sizeSmall) { this.sizeSmall = sizeSmall; }

        public double getSizeMedium() { return sizeMedium; }
        public void setSizeMedium(double sizeMedium) { this.sizeMedium = sizeMedium; }

        public double getSizeLarge() { return sizeLarge; }
        public void setSizeLarge(double sizeLarge) { this.sizeLarge = sizeLarge; }

        public double getSizeAdequateScore() { return sizeAdequateScore; }
        public void setSizeAdequateScore(double sizeAdequateScore) { this.sizeAdequateScore = sizeAdequateScore; }

        public double getAspectMin() { return aspectMin; }
        public void setAspectMin(double aspectMin) { this.aspectMin = aspectMin; }

        public double getAspectMax() { return aspectMax; }
        public void setAspectMax(double aspectMax) { this.aspectMax = aspectMax; }

        public double getAspectOptimalMin() { return aspectOptimalMin; }
        public void setAspectOptimalMin(double aspectOptimalMin) { this.aspectOptimalMin = aspectOptimalMin; }

        public double getAspectOptimalMax() { return aspectOptimalMax; }
        public void setAspectOptimalMax(double aspectOptimalMax) { this.aspectOptimalMax = aspectOptimalMax; }

        public double getAspectAcceptableScore() { return aspectAcceptableScore; }
        public void setAspectAcceptableScore(double aspectAcceptableScore) { this.aspectAcceptableScore = aspectAcceptableScore; }

        public double getBlurWeight() { return blurWeight; }
        public void setBlurWeight(double blurWeight) { this.blurWeight = blurWeight; }

        public double getLightingWeight() { return lightingWeight; }
        public void setLightingWeight(double lightingWeight) { this.lightingWeight = lightingWeight; }

        public double getSizeWeight() { return sizeWeight; }
        public void setSizeWeight(double sizeWeight) { this.sizeWeight = sizeWeight; }

        public double getAspectWeight() { return aspectWeight; }
        public void setAspectWeight(double aspectWeight) { this.aspectWeight = aspectWeight; }

        public double getConfidenceWeight() { return confidenceWeight; }
        public void setConfidenceWeight(double confidenceWeight) { this.confidenceWeight = confidenceWeight; }

        public double getGoodQualityThreshold() { return goodQualityThreshold; }
        public void setGoodQualityThreshold(double goodQualityThreshold) { this.goodQualityThreshold = goodQualityThreshold; }

        public double getExcellentMin() { return excellentMin; }
        public void setExcellentMin(double excellentMin) { this.excellentMin = excellentMin; }

        public double getGoodMin() { return goodMin; }
        public void setGoodMin(double goodMin) { this.goodMin = goodMin; }

        public double getFairMin() { return fairMin; }
        public void setFairMin(double fairMin) { this.fairMin = fairMin; }
    }

    /**
     * Clustering-result quality bands and weights.
     */
    public static class ClusteringQuality {
        private double silhouetteExcellent = 0.7;
        private double silhouetteGood = 0.5;
        private double silhouetteFair = 0.25;

        private double dbExcellent = 0.5;
        private double dbGood = 1.0;
        private double dbFair = 1.5;
        private double dbCap = 3.0;

        private double noiseAcceptable = 0.15;
        private double noiseConcerning = 0.30;
        private double noiseOverClustering = 0.05;

        private double compactnessCapCosine = 1.0;
        private double compactnessCapEuclidean = 2.0;

        private double silhouetteWeight = 0.40;
        private double daviesBouldinWeight = 0.30;
        private double noiseWeight = 0.20;
        private double compactnessWeight = 0.10;

        private int nearSingletonSize = 2;
        private double nearSingletonRatio = 0.3;
        private double clustersPerFaceRatio = 0.3;
        private double dominantClusterFactor = 10.0;
        private double singleClusterQualityFactor = 0.3;

        public double getSilhouetteExcellent() { return silhouetteExcellent; }
        public void setSilhouetteExcellent(double silhouetteExcellent) { this.silhouetteExcellent = silhouetteExcellent; }

        public double getSilhouetteGood() { return silhouetteGood; }
        public void setSilhouetteGood(double silhouetteGood) { this.silhouetteGood = silhouetteGood; }

        public double getSilhouetteFair() { return silhouetteFair; }
        public void setSilhouetteFair(double silhouetteFair) { this.silhouetteFair = silhouetteFair; }

        public double getDbExcellent() { return dbExcellent; }
        public void setDbExcellent(double dbExcellent) { this.dbExcellent = dbExcellent; }

        public double getDbGood() { return dbGood; }
        public void setDbGood(double dbGood) { this.dbGood = dbGood; }

        public double getDbFair() { return dbFair; }
        public void setDbFair(double dbFair) { this.dbFair = dbFair; }

        public double getDbCap() { return dbCap; }
        public void setDbCap(double dbCap) { this.dbCap = dbCap; }

        public double getNoiseAcceptable() { return noiseAcceptable; }
        public void setNoiseAcceptable(double noiseAcceptable) { this.noiseAcceptable = noiseAcceptable; }

        public double getNoiseConcerning() { return noiseConcerning; }
        public void setNoiseConcerning(double noiseConcerning) { this.noiseConcerning = noiseConcerning; }

        public double getNoiseOverClustering() { return noiseOverClustering; }
        public void setNoiseOverClustering(double noiseOverClustering) { this.noiseOverClustering = noiseOverClustering; }

        public double getCompactnessCapCosine() { return compactnessCapCosine; }
        public void setCompactnessCapCosine(double compactnessCapCosine) { this.compactnessCapCosine = compactnessCapCosine; }

        public double getCompactnessCapEuclidean() { return compactnessCapEuclidean; }
        public void setCompactnessCapEuclidean(double compactnessCapEuclidean) { this.compactnessCapEuclidean = compactnessCapEuclidean; }

        public double getSilhouetteWeight() { return silhouetteWeight; }
        public void setSilhouetteWeight(double silhouetteWeight) { this.silhouetteWeight = silhouetteWeight; }

        public double getDaviesBouldinWeight() { return daviesBouldinWeight; }
        public void setDaviesBouldinWeight(double daviesBouldinWeight) { this.daviesBouldinWeight = daviesBouldinWeight; }

        public double getNoiseWeight() { return noiseWeight; }
        public void setNoiseWeight(double noiseWeight) { this.noiseWeight = noiseWeight; }

        public double getCompactnessWeight() { return compactnessWeight; }
        public void setCompactnessWeight(double compactnessWeight) { this.compactnessWeight = compactnessWeight; }

        public int getNearSingletonSize() { return nearSingletonSize; }
        public void setNearSingletonSize(int nearSingletonSize) { this.nearSingletonSize = nearSingletonSize; }

        public double getNearSingletonRatio() { return nearSingletonRatio; }
        public void setNearSingletonRatio(double nearSingletonRatio) { this.nearSingletonRatio = nearSingletonRatio; }

        public double getClustersPerFaceRatio() { return clustersPerFaceRatio; }
        public void setClustersPerFaceRatio(double clustersPerFaceRatio) { this.clustersPerFaceRatio = clustersPerFaceRatio; }

        public double getDominantClusterFactor() { return dominantClusterFactor; }
        public void setDominantClusterFactor(double dominantClusterFactor) { this.dominantClusterFactor = dominantClusterFactor; }

        public double getSingleClusterQualityFactor() { return singleClusterQualityFactor; }
        public void setSingleClusterQualityFactor(double singleClusterQualityFactor) { this.singleClusterQualityFactor = singleClusterQualityFactor; }
    }

    /**
     * Representative selection policy.
     */
    public static class Selection {
        private double qualityThreshold = 60.0;
        private double qualityWeight = 0.70;
        private double proximityWeight = 0.30;
        private double basicMinConfidence = 0.6;
        private double basicMinSizeScore = 40.0;

        public double getQualityThreshold() { return qualityThreshold; }
        public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }

        public double getQualityWeight() { return qualityWeight; }
        public void setQualityWeight(double qualityWeight) { this.qualityWeight = qualityWeight; }

        public double getProximityWeight() { return proximityWeight; }
        public void setProximityWeight(double proximityWeight) { this.proximityWeight = proximityWeight; }

        public double getBasicMinConfidence() { return basicMinConfidence; }
        public void setBasicMinConfidence(double basicMinConfidence) { this.basicMinConfidence = basicMinConfidence; }

        public double getBasicMinSizeScore() { return basicMinSizeScore; }
        public void setBasicMinSizeScore(double basicMinSizeScore) { this.basicMinSizeScore = basicMinSizeScore; }
    }

    /**
     * Worker pool that runs clustering jobs off the caller's thread.
     */
    public static class Executor {
        private int poolSize = 2;
        private int queueCapacity = 16;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
