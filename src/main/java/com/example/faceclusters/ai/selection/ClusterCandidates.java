package com.example.faceclusters.ai.selection;

import com.example.faceclusters.ai.clustering.DistanceMetric;
import com.example.faceclusters.ai.quality.FaceQualityMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * The members of one cluster prepared for representative selection.
 *
 * @param members        in the order the cluster lists them
 * @param centroidUsable false when the centroid cannot rank members (single member,
 *                       non-finite values, or a zero vector under cosine distance)
 */
public record ClusterCandidates(
        String clusterKey,
        List<RepresentativeCandidate> members,
        boolean centroidUsable
) {

    public ClusterCandidates {
        members = List.copyOf(members);
    }

    /**
     * Builds candidates from member vectors, their quality metrics and the centroid.
     * Lists are index-aligned.
     */
    public static ClusterCandidates of(String clusterKey, List<String> ids, List<float[]> vectors,
                                       List<FaceQualityMetrics> qualities, float[] centroid,
                                       DistanceMetric metric) {
        boolean usable = isCentroidUsable(centroid, ids.size(), metric);

        List<RepresentativeCandidate> members = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            double distance = Double.NaN;
            if (usable) {
                distance = metric.distance(vectors.get(i), centroid);
                if (!Double.isFinite(distance)) {
                    usable = false;
                }
            }
            members.add(new RepresentativeCandidate(ids.get(i), qualities.get(i), distance));
        }
        if (!usable) {
            List<RepresentativeCandidate> stripped = new ArrayList<>(members.size());
            for (RepresentativeCandidate c : members) {
                stripped.add(new RepresentativeCandidate(c.observationId(), c.quality(), Double.NaN));
            }
            members = stripped;
        }
        return new ClusterCandidates(clusterKey, members, usable);
    }

    static boolean isCentroidUsable(float[] centroid, int memberCount, DistanceMetric metric) {
        if (centroid == null || centroid.length == 0 || memberCount < 2) {
            return false;
        }
        double squaredNorm = 0.0;
        for (float v : centroid) {
            if (!Float.isFinite(v)) {
                return false;
            }
            squaredNorm += (double) v * v;
        }
        return metric != DistanceMetric.COSINE || squaredNorm > 0.0;
    }
}
