package com.example.faceclusters.ai.orchestrator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw DBSCAN labels to stable cluster keys.
 * <p>
 * Clusters are ranked by size, largest first, ties broken by the smallest member id,
 * and keyed {@code face_001}, {@code face_002}, ... in rank order. The keys depend
 * only on the partition, never on the label numbers the algorithm happened to use.
 */
final class ClusterKeyAssigner {

    static final String KEY_FORMAT = "face_%03d";
    static final String DISPLAY_NAME_FORMAT = "Person %d";

    private ClusterKeyAssigner() {}

    /**
     * @param labels one raw label per row, negative for noise
     * @param ids    observation id per row
     * @return raw label to key, iterating in rank order
     */
    static Map<Integer, String> assign(int[] labels, List<String> ids) {
        Map<Integer, List<String>> members = new HashMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] >= 0) {
                members.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(ids.get(i));
            }
        }

        List<Map.Entry<Integer, List<String>>> ranked = new ArrayList<>(members.entrySet());
        ranked.sort(Comparator
                .comparingInt((Map.Entry<Integer, List<String>> e) -> e.getValue().size()).reversed()
                .thenComparing(e -> Collections.min(e.getValue())));

        Map<Integer, String> keys = new LinkedHashMap<>();
        int rank = 1;
        for (Map.Entry<Integer, List<String>> entry : ranked) {
            keys.put(entry.getKey(), String.format(KEY_FORMAT, rank++));
        }
        return keys;
    }

    static String displayName(int rank) {
        return String.format(DISPLAY_NAME_FORMAT, rank);
    }
}
