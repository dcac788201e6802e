package com.example.faceclusters.ai.clustering;

import com.example.faceclusters.model.QualityLabel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistical assessment of one clustering result.
 * <p>
 * When fewer than two clusters exist, silhouette and Davies-Bouldin are undefined;
 * {@link #isSeparationDefined()} is then false and the two fields carry
 * {@link #SILHOUETTE_UNDEFINED} and {@link #DAVIES_BOULDIN_UNDEFINED}.
 */
public class ClusterQualityMetrics {

    public static final double SILHOUETTE_UNDEFINED = 0.0;
    public static final double SILHOUETTE_WORST = -1.0;
    public static final double DAVIES_BOULDIN_UNDEFINED = 999.0;

    private double silhouetteScore;
    private double daviesBouldinIndex;
    private double avgClusterCompactness;
    private double avgClusterSeparation;
    private int clusterCount;
    private int faceCount;
    private int noiseCount;
    private double noiseRatio;
    private boolean separationDefined;
    private List<Integer> clusterSizes = new ArrayList<>();
    private double overallQuality;
    private QualityLabel qualityLabel = QualityLabel.POOR;
    private QualityLabel silhouetteLabel = QualityLabel.POOR;
    private QualityLabel daviesBouldinLabel = QualityLabel.POOR;
    private NoiseLevel noiseLevel = NoiseLevel.CONCERNING;
    private Map<String, PerClusterMetrics> perClusterMetrics = new LinkedHashMap<>();
    private List<String> tuningSuggestions = new ArrayList<>();

    public ClusterQualityMetrics() {}

    // Getters and Setters
    public double getSilhouetteScore() { return silhouetteScore; }
    public void setSilhouetteScore(double silhouetteScore) { this.silhouetteScore = silhouetteScore; }

    public double getDaviesBouldinIndex() { return daviesBouldinIndex; }
    public void setDaviesBouldinIndex(double daviesBouldinIndex) { this.daviesBouldinIndex = daviesBouldinIndex; }

    public double getAvgClusterCompactness() { return avgClusterCompactness; }
    public void setAvgClusterCompactness(double avgClusterCompactness) { this.avgClusterCompactness = avgClusterCompactness; }

    public double getAvgClusterSeparation() { return avgClusterSeparation; }
    public void setAvgClusterSeparation(double avgClusterSeparation) { this.avgClusterSeparation = avgClusterSeparation; }

    public int getClusterCount() { return clusterCount; }
    public void setClusterCount(int clusterCount) { this.clusterCount = clusterCount; }

    public int getFaceCount() { return faceCount; }
    public void setFaceCount(int faceCount) { this.faceCount = faceCount; }

    public int getNoiseCount() { return noiseCount; }
    public void setNoiseCount(int noiseCount) { this.noiseCount = noiseCount; }

    public double getNoiseRatio() { return noiseRatio; }
    public void setNoiseRatio(double noiseRatio) { this.noiseRatio = noiseRatio; }

    public boolean isSeparationDefined() { return separationDefined; }
    public void setSeparationDefined(boolean separationDefined) { this.separationDefined = separationDefined; }

    public List<Integer> getClusterSizes() { return clusterSizes; }
    public void setClusterSizes(List<Integer> clusterSizes) { this.clusterSizes = clusterSizes; }

    public double getOverallQuality() { return overallQuality; }
    public void setOverallQuality(double overallQuality) { this.overallQuality = overallQuality; }

    public QualityLabel getQualityLabel() { return qualityLabel; }
    public void setQualityLabel(QualityLabel qualityLabel) { this.qualityLabel = qualityLabel; }

    public QualityLabel getSilhouetteLabel() { return silhouetteLabel; }
    public void setSilhouetteLabel(QualityLabel silhouetteLabel) { this.silhouetteLabel = silhouetteLabel; }

    public QualityLabel getDaviesBouldinLabel() { return daviesBouldinLabel; }
    public void setDaviesBouldinLabel(QualityLabel daviesBouldinLabel) { this.daviesBouldinLabel = daviesBouldinLabel; }

    public NoiseLevel getNoiseLevel() { return noiseLevel; }
    public void setNoiseLevel(NoiseLevel noiseLevel) { this.noiseLevel = noiseLevel; }

    public Map<String, PerClusterMetrics> getPerClusterMetrics() { return perClusterMetrics; }
    public void setPerClusterMetrics(Map<String, PerClusterMetrics> perClusterMetrics) { this.perClusterMetrics = perClusterMetrics; }

    public List<String> getTuningSuggestions() { return tuningSuggestions; }
    public void setTuningSuggestions(List<String> tuningSuggestions) { this.tuningSuggestions = tuningSuggestions; }

    @Override
    public String toString() {
        return String.format("ClusterQualityMetrics{clusters=%d, faces=%d, noise=%d (%.1f%%), silhouette=%.3f, db=%.3f, overall=%.1f %s}",
                clusterCount, faceCount, noiseCount, noiseRatio * 100, silhouetteScore, daviesBouldinIndex,
                overallQuality, qualityLabel.getDisplayName());
    }
}
