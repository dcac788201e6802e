package com.example.faceclusters.model;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit entry for one clustering run, stored with the cluster set it produced.
 */
public class ClusterRunRecord {
    private String runId;
    private String collectionId;
    private Date startedAt;
    private Date finishedAt;

    // Parameters
    private double eps;
    private int minSamples;
    private String distanceMetric;
    private String parameterSource;
    private String parameterRationale;

    // Counters
    private int observationsLoaded;
    private int observationsSkipped;
    private Map<String, Integer> skippedByReason = new LinkedHashMap<>();
    private int clusterCount;
    private int noiseCount;
    private Map<String, Integer> representativesByLevel = new LinkedHashMap<>();

    // Clustering quality at computation time
    private Map<String, Object> qualityMetrics = new LinkedHashMap<>();
    private List<String> tuningSuggestions = new ArrayList<>();

    public ClusterRunRecord() {}

    // Getters and Setters
    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getCollectionId() { return collectionId; }
    public void setCollectionId(String collectionId) { this.collectionId = collectionId; }

    public Date getStartedAt() { return startedAt; }
    public void setStartedAt(Date startedAt) { this.startedAt = startedAt; }

    public Date getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Date finishedAt) { this.finishedAt = finishedAt; }

    public double getEps() { return eps; }
    public void setEps(double eps) { this.eps = eps; }

    public int getMinSamples() { return minSamples; }
    public void setMinSamples(int minSamples) { this.minSamples = minSamples; }

    public String getDistanceMetric() { return distanceMetric; }
    public void setDistanceMetric(String distanceMetric) { this.distanceMetric = distanceMetric; }

    public String getParameterSource() { return parameterSource; }
    public void setParameterSource(String parameterSource) { this.parameterSource = parameterSource; }

    public String getParameterRationale() { return parameterRationale; }
    public void setParameterRationale(String parameterRationale) { this.parameterRationale = parameterRationale; }

    public int getObservationsLoaded() { return observationsLoaded; }
    public void setObservationsLoaded(int observationsLoaded) { this.observationsLoaded = observationsLoaded; }

    public int getObservationsSkipped() { return observationsSkipped; }
    public void setObservationsSkipped(int observationsSkipped) { this.observationsSkipped = observationsSkipped; }

    public Map<String, Integer> getSkippedByReason() { return skippedByReason; }
    public void setSkippedByReason(Map<String, Integer> skippedByReason) { this.skippedByReason = skippedByReason; }

    public int getClusterCount() { return clusterCount; }
    public void setClusterCount(int clusterCount) { this.clusterCount = clusterCount; }

    public int getNoiseCount() { return noiseCount; }
    public void setNoiseCount(int noiseCount) { this.noiseCount = noiseCount; }

    public Map<String, Integer> getRepresentativesByLevel() { return representativesByLevel; }
    public void setRepresentativesByLevel(Map<String, Integer> representativesByLevel) { this.representativesByLevel = representativesByLevel; }

    public Map<String, Object> getQualityMetrics() { return qualityMetrics; }
    public void setQualityMetrics(Map<String, Object> qualityMetrics) { this.qualityMetrics = qualityMetrics; }

    public List<String> getTuningSuggestions() { return tuningSuggestions; }
    public void setTuningSuggestions(List<String> tuningSuggestions) { this.tuningSuggestions = tuningSuggestions; }
}
