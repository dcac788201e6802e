package com.example.faceclusters.ai.clustering;

import com.example.faceclusters.config.FaceClusteringProperties;
import com.example.faceclusters.config.WeightSets;
import com.example.faceclusters.model.QualityLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntFunction;

/**
 * Scores how well a labelling separates an embedding set.
 * <p>
 * Reports silhouette, Davies-Bouldin, compactness, separation and noise ratio,
 * folds them into a 0-100 score and derives advisory tuning suggestions for the
 * clustering parameters. Degenerate inputs (no clusters, one cluster, mismatched
 * lengths) yield sentinel values instead of exceptions.
 */
@Service
public class ClusteringQualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ClusteringQualityAnalyzer.class);

    private final FaceClusteringProperties.ClusteringQuality config;

    public ClusteringQualityAnalyzer(FaceClusteringProperties properties) {
        this.config = properties.getClusteringQuality();
        WeightSets.requireUnitSum("Clustering quality",
                config.getSilhouetteWeight(), config.getDaviesBouldinWeight(),
                config.getNoiseWeight(), config.getCompactnessWeight());
    }

    public double weightSum() {
        return WeightSets.sum(config.getSilhouetteWeight(), config.getDaviesBouldinWeight(),
                config.getNoiseWeight(), config.getCompactnessWeight());
    }

    public ClusterQualityMetrics analyze(float[][] embeddings, int[] labels, DistanceMetric metric) {
        return analyze(embeddings, labels, metric, String::valueOf);
    }

    /**
     * @param embeddings N x D matrix
     * @param labels     N labels, {@link DbscanClusterer#NOISE} for unassigned rows
     * @param metric     distance used for silhouette, compactness and separation
     * @param keyNamer   names each label in {@link ClusterQualityMetrics#getPerClusterMetrics()}
     */
    public ClusterQualityMetrics analyze(float[][] embeddings, int[] labels, DistanceMetric metric,
                                         IntFunction<String> keyNamer) {
        if (embeddings == null || labels == null || embeddings.length != labels.length) {
            log.error("Embeddings and labels do not line up: {} vs {}",
                    embeddings == null ? "null" : embeddings.length,
                    labels == null ? "null" : labels.length);
            return insufficientData(labels == null ? 0 : labels.length);
        }

        try {
            return doAnalyze(embeddings, labels, metric, keyNamer);
        } catch (RuntimeException e) {
            log.error("Clustering quality analysis failed: {}", e.getMessage(), e);
            return insufficientData(labels.length);
        }
    }

    private ClusterQualityMetrics doAnalyze(float[][] embeddings, int[] labels, DistanceMetric metric,
                                            IntFunction<String> keyNamer) {
        int faceCount = labels.length;

        // label -> member row indices, ordered by label
        Map<Integer, List<Integer>> members = new TreeMap<>();
        int noiseCount = 0;
        for (int i = 0; i < faceCount; i++) {
            if (labels[i] < 0) {
                noiseCount++;
            } else {
                members.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(i);
            }
        }

        int clusterCount = members.size();
        if (clusterCount == 0) {
            log.warn("No clusters to analyze ({} faces, all noise)", faceCount);
            return insufficientData(faceCount);
        }

        int[] clusterLabels = members.keySet().stream().mapToInt(Integer::intValue).toArray();
        int[][] clusterRows = new int[clusterCount][];
        List<Integer> sizes = new ArrayList<>();
        for (int c = 0; c < clusterCount; c++) {
            clusterRows[c] = members.get(clusterLabels[c]).stream().mapToInt(Integer::intValue).toArray();
            sizes.add(clusterRows[c].length);
        }

        float[][] centroids = new float[clusterCount][];
        for (int c = 0; c < clusterCount; c++) {
            centroids[c] = Centroids.mean(embeddings, clusterRows[c]);
        }

        double noiseRatio = (double) noiseCount / faceCount;
        double[] compactness = new double[clusterCount];
        for (int c = 0; c < clusterCount; c++) {
            compactness[c] = meanDistanceToCentroid(embeddings, clusterRows[c], centroids[c], metric);
        }
        double avgCompactness = averageCompactness(clusterRows, compactness);

        ClusterQualityMetrics m = new ClusterQualityMetrics();
        m.setFaceCount(faceCount);
        m.setNoiseCount(noiseCount);
        m.setNoiseRatio(noiseRatio);
        m.setNoiseLevel(rateNoise(noiseRatio));
        m.setClusterCount(clusterCount);
        m.setClusterSizes(sizes);
        m.setAvgClusterCompactness(avgCompactness);

        Map<String, PerClusterMetrics> perCluster = new LinkedHashMap<>();

        if (clusterCount < 2) {
            log.warn("Only {} cluster found; silhouette and Davies-Bouldin are undefined", clusterCount);
            m.setSeparationDefined(false);
            m.setSilhouetteScore(ClusterQualityMetrics.SILHOUETTE_UNDEFINED);
            m.setDaviesBouldinIndex(ClusterQualityMetrics.DAVIES_BOULDIN_UNDEFINED);
            m.setSilhouetteLabel(QualityLabel.POOR);
            m.setDaviesBouldinLabel(QualityLabel.POOR);
            m.setAvgClusterSeparation(0.0);
            perCluster.put(keyNamer.apply(clusterLabels[0]),
                    new PerClusterMetrics(sizes.get(0), ClusterQualityMetrics.SILHOUETTE_UNDEFINED, compactness[0], 0.0));
            m.setPerClusterMetrics(perCluster);

            double overall = normalizeNoise(noiseRatio) * config.getSingleClusterQualityFactor();
            m.setOverallQuality(clamp(overall));
            m.setQualityLabel(QualityLabel.forScore(m.getOverallQuality()));
            m.setTuningSuggestions(buildSuggestions(m));
            return m;
        }

        double[] sampleSilhouettes = sampleSilhouettes(embeddings, clusterRows, metric);
        double silhouette = mean(sampleSilhouettes);
        double daviesBouldin = daviesBouldin(embeddings, clusterRows, centroids);

        double[][] centroidDistances = new double[clusterCount][clusterCount];
        double separationSum = 0.0;
        int pairs = 0;
        for (int a = 0; a < clusterCount; a++) {
            for (int b = a + 1; b < clusterCount; b++) {
                double d = metric.distance(centroids[a], centroids[b]);
                centroidDistances[a][b] = d;
                centroidDistances[b][a] = d;
                separationSum += d;
                pairs++;
            }
        }

        int offset = 0;
        for (int c = 0; c < clusterCount; c++) {
            double clusterSilhouette = 0.0;
            for (int k = 0; k < clusterRows[c].length; k++) {
                clusterSilhouette += sampleSilhouettes[offset + k];
            }
            clusterSilhouette /= clusterRows[c].length;
            offset += clusterRows[c].length;

            double nearest = Double.MAX_VALUE;
            for (int other = 0; other < clusterCount; other++) {
                if (other != c) {
                    nearest = Math.min(nearest, centroidDistances[c][other]);
                }
            }
            perCluster.put(keyNamer.apply(clusterLabels[c]),
                    new PerClusterMetrics(clusterRows[c].length, clusterSilhouette, compactness[c], nearest));
        }

        m.setSeparationDefined(true);
        m.setSilhouetteScore(silhouette);
        m.setDaviesBouldinIndex(daviesBouldin);
        m.setSilhouetteLabel(rateSilhouette(silhouette));
        m.setDaviesBouldinLabel(rateDaviesBouldin(daviesBouldin));
        m.setAvgClusterSeparation(pairs > 0 ? separationSum / pairs : 0.0);
        m.setPerClusterMetrics(perCluster);
        m.setOverallQuality(overallQuality(silhouette, daviesBouldin, noiseRatio, avgCompactness, metric));
        m.setQualityLabel(QualityLabel.forScore(m.getOverallQuality()));
        m.setTuningSuggestions(buildSuggestions(m));
        return m;
    }

    /**
     * Silhouette values, laid out cluster by cluster in {@code clusterRows} order.
     * Members of a size-1 cluster score 0.
     */
    private double[] sampleSilhouettes(float[][] embeddings, int[][] clusterRows, DistanceMetric metric) {
        int clusterCount = clusterRows.length;
        int total = 0;
        for (int[] rows : clusterRows) {
            total += rows.length;
        }
        double[] result = new double[total];

        int out = 0;
        for (int c = 0; c < clusterCount; c++) {
            for (int row : clusterRows[c]) {
                double[] sums = new double[clusterCount];
                for (int other = 0; other < clusterCount; other++) {
                    for (int j : clusterRows[other]) {
                        if (j != row) {
                            sums[other] += metric.distance(embeddings[row], embeddings[j]);
                        }
                    }
                }

                int ownSize = clusterRows[c].length;
                if (ownSize < 2) {
                    result[out++] = 0.0;
                    continue;
                }
                double a = sums[c] / (ownSize - 1);
                double b = Double.MAX_VALUE;
                for (int other = 0; other < clusterCount; other++) {
                    if (other != c) {
                        b = Math.min(b, sums[other] / clusterRows[other].length);
                    }
                }
                double denominator = Math.max(a, b);
                result[out++] = denominator > 0 ? (b - a) / denominator : 0.0;
            }
        }
        return result;
    }

    /**
     * Davies-Bouldin on Euclidean geometry: mean over clusters of the worst
     * (S_i + S_j) / M_ij ratio. Coincident centroids contribute 0.
     */
    private double daviesBouldin(float[][] embeddings, int[][] clusterRows, float[][] centroids) {
        int k = clusterRows.length;
        double[] scatter = new double[k];
        for (int c = 0; c < k; c++) {
            scatter[c] = meanDistanceToCentroid(embeddings, clusterRows[c], centroids[c], DistanceMetric.EUCLIDEAN);
        }

        double total = 0.0;
        for (int i = 0; i < k; i++) {
            double worst = 0.0;
            for (int j = 0; j < k; j++) {
                if (i == j) {
                    continue;
                }
                double separation = DistanceMetric.EUCLIDEAN.distance(centroids[i], centroids[j]);
                double ratio = separation > 0 ? (scatter[i] + scatter[j]) / separation : 0.0;
                worst = Math.max(worst, ratio);
            }
            total += worst;
        }
        return total / k;
    }

    private double overallQuality(double silhouette, double daviesBouldin, double noiseRatio,
                                  double compactness, DistanceMetric metric) {
        double silhouetteNormalized = ((silhouette + 1.0) / 2.0) * 100.0;
        double dbNormalized = Math.max(0.0, 100.0 - (daviesBouldin / config.getDbCap()) * 100.0);
        double noiseNormalized = normalizeNoise(noiseRatio);
        double cap = metric == DistanceMetric.COSINE
                ? config.getCompactnessCapCosine()
                : config.getCompactnessCapEuclidean();
        double compactnessNormalized = Math.max(0.0, 100.0 - (compactness / cap) * 100.0);

        double overall = silhouetteNormalized * config.getSilhouetteWeight()
                + dbNormalized * config.getDaviesBouldinWeight()
                + noiseNormalized * config.getNoiseWeight()
                + compactnessNormalized * config.getCompactnessWeight();
        return clamp(overall);
    }

    private double normalizeNoise(double noiseRatio) {
        return Math.max(0.0, 100.0 - (noiseRatio / config.getNoiseConcerning()) * 100.0);
    }

    public QualityLabel rateSilhouette(double silhouette) {
        if (silhouette > config.getSilhouetteExcellent()) {
            return QualityLabel.EXCELLENT;
        } else if (silhouette >= config.getSilhouetteGood()) {
            return QualityLabel.GOOD;
        } else if (silhouette >= config.getSilhouetteFair()) {
            return QualityLabel.FAIR;
        }
        return QualityLabel.POOR;
    }

    public QualityLabel rateDaviesBouldin(double daviesBouldin) {
        if (daviesBouldin < config.getDbExcellent()) {
            return QualityLabel.EXCELLENT;
        } else if (daviesBouldin <= config.getDbGood()) {
            return QualityLabel.GOOD;
        } else if (daviesBouldin <= config.getDbFair()) {
            return QualityLabel.FAIR;
        }
        return QualityLabel.POOR;
    }

    public NoiseLevel rateNoise(double noiseRatio) {
        if (noiseRatio < config.getNoiseAcceptable()) {
            return NoiseLevel.ACCEPTABLE;
        } else if (noiseRatio <= config.getNoiseConcerning()) {
            return NoiseLevel.MODERATE;
        }
        return NoiseLevel.CONCERNING;
    }

    /**
     * Rule-based, ordered advice on eps / min_samples. Advisory only.
     */
    List<String> buildSuggestions(ClusterQualityMetrics m) {
        List<String> suggestions = new ArrayList<>();

        if (m.getClusterCount() == 0) {
            suggestions.add(String.format(
                    "Insufficient data: no clusters were formed from %d faces. "
                    + "Increase eps or decrease min_samples, or add more faces before clustering.",
                    m.getFaceCount()));
            return suggestions;
        }

        if (!m.isSeparationDefined()) {
            suggestions.add("Only one cluster was found: silhouette and Davies-Bouldin cannot be computed. "
                    + "If several people are present, decrease eps to split them.");
        } else {
            if (m.getSilhouetteScore() < config.getSilhouetteFair()) {
                suggestions.add(String.format(
                        "Low silhouette score (%.3f): consider increasing eps to merge similar clusters, "
                        + "or decreasing eps to split overlapping clusters.", m.getSilhouetteScore()));
            }
            if (m.getDaviesBouldinIndex() > config.getDbFair()) {
                suggestions.add(String.format(
                        "High Davies-Bouldin index (%.3f): clusters are too similar. "
                        + "Try increasing eps to merge them, or adjusting min_samples.", m.getDaviesBouldinIndex()));
            }
        }

        List<Integer> sizes = m.getClusterSizes();
        long nearSingletons = sizes.stream().filter(s -> s <= config.getNearSingletonSize()).count();
        boolean manySmallClusters = m.getClusterCount() > m.getFaceCount() * config.getClustersPerFaceRatio()
                || nearSingletons > m.getClusterCount() * config.getNearSingletonRatio();

        if (m.getNoiseRatio() > config.getNoiseConcerning()) {
            suggestions.add(String.format(
                    "High noise ratio (%.1f%%): too many unassigned faces. "
                    + "Try increasing eps or decreasing min_samples to include more faces in clusters.",
                    m.getNoiseRatio() * 100));
        } else if (m.getNoiseRatio() >= config.getNoiseAcceptable()) {
            suggestions.add(String.format(
                    "Moderate noise ratio (%.1f%%): a slightly larger eps or smaller min_samples "
                    + "may recover some unassigned faces.", m.getNoiseRatio() * 100));
        } else if (m.getNoiseRatio() < config.getNoiseOverClustering() && manySmallClusters) {
            suggestions.add(String.format(
                    "Very low noise ratio (%.1f%%) with many small clusters: likely over-clustering. "
                    + "eps or min_samples is too small; increase eps to merge clusters of the same person "
                    + "or raise min_samples.", m.getNoiseRatio() * 100));
        }

        if (sizes.size() >= 2) {
            int max = sizes.stream().mapToInt(Integer::intValue).max().orElse(0);
            double avg = sizes.stream().mapToInt(Integer::intValue).average().orElse(0.0);
            if (max > avg * config.getDominantClusterFactor()) {
                suggestions.add(String.format(
                        "One very large cluster (size %d vs avg %.1f): may indicate under-clustering. "
                        + "Try decreasing eps to split large clusters.", max, avg));
            }
        }

        if (nearSingletons > m.getClusterCount() * config.getNearSingletonRatio()) {
            suggestions.add(String.format(
                    "Many near-singleton clusters (%d/%d with at most %d members): "
                    + "raise min_samples to require larger clusters.",
                    nearSingletons, m.getClusterCount(), config.getNearSingletonSize()));
        }

        if (m.isSeparationDefined()) {
            long poorClusters = m.getPerClusterMetrics().values().stream()
                    .filter(p -> p.silhouette() < config.getSilhouetteFair())
                    .count();
            if (poorClusters > 0) {
                suggestions.add(String.format(
                        "%d clusters have poor silhouette scores: these may need manual review or re-clustering.",
                        poorClusters));
            }
        }

        if (suggestions.isEmpty()) {
            suggestions.add("Clustering quality looks good. No tuning needed.");
        }
        return suggestions;
    }

    private ClusterQualityMetrics insufficientData(int faceCount) {
        ClusterQualityMetrics m = new ClusterQualityMetrics();
        m.setFaceCount(faceCount);
        m.setNoiseCount(faceCount);
        m.setNoiseRatio(1.0);
        m.setNoiseLevel(NoiseLevel.CONCERNING);
        m.setClusterCount(0);
        m.setSeparationDefined(false);
        m.setSilhouetteScore(ClusterQualityMetrics.SILHOUETTE_WORST);
        m.setDaviesBouldinIndex(ClusterQualityMetrics.DAVIES_BOULDIN_UNDEFINED);
        m.setAvgClusterCompactness(0.0);
        m.setAvgClusterSeparation(0.0);
        m.setOverallQuality(0.0);
        m.setQualityLabel(QualityLabel.POOR);
        m.setTuningSuggestions(buildSuggestions(m));
        return m;
    }

    private static double meanDistanceToCentroid(float[][] embeddings, int[] rows, float[] centroid,
                                                 DistanceMetric metric) {
        double sum = 0.0;
        for (int row : rows) {
            sum += metric.distance(embeddings[row], centroid);
        }
        return sum / rows.length;
    }

    // Singleton clusters have no spread and are left out of the average
    private static double averageCompactness(int[][] clusterRows, double[] compactness) {
        double sum = 0.0;
        int counted = 0;
        for (int c = 0; c < clusterRows.length; c++) {
            if (clusterRows[c].length >= 2) {
                sum += compactness[c];
                counted++;
            }
        }
        return counted > 0 ? sum / counted : 0.0;
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
