package com.example.faceclusters.dao;

import com.example.faceclusters.model.ClusterRunRecord;
import com.example.faceclusters.model.ClusterSet;
import com.example.faceclusters.model.FaceCluster;
import com.google.cloud.Timestamp;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FaceClusterDaoImplTest {

    @Test
    public void testClusterMapping_StoredFieldsReadBack() {
        // Given
        FaceCluster cluster = new FaceCluster();
        cluster.setClusterKey("face_001");
        cluster.setCollectionId("family");
        cluster.setDisplayName("Person 1");
        cluster.setMemberIds(List.of("a", "b", "c"));
        cluster.setPhotoCount(2);
        cluster.setCentroid(new byte[]{0, 0, (byte) 0x80, 0x3F});
        cluster.setRepresentativeId("b");
        cluster.setRepresentativeLevel(1);
        Map<String, Object> quality = new LinkedHashMap<>();
        quality.put("overallQuality", 72.5);
        cluster.setRepresentativeQuality(quality);
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("silhouette", 0.8);
        cluster.setQualitySnapshot(snapshot);

        // When
        Map<String, Object> document = FaceClusterDaoImpl.clusterToMap(cluster);
        document.put("photoCount", 2L);
        document.put("representativeLevel", 1L);
        FaceCluster read = FaceClusterDaoImpl.documentToCluster("face_001", document);

        // Then
        assertEquals(cluster, read, "Firestore longs and blobs should map back to the same cluster");
    }

    @Test
    public void testDocumentToRun_TimestampsAndLongs() {
        // Given
        Date started = new Date(1_700_000_000_000L);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("runId", "run-1");
        document.put("collectionId", "family");
        document.put("startedAt", Timestamp.of(started));
        document.put("eps", 0.42);
        document.put("minSamples", 3L);
        document.put("skippedByReason", Map.of("EMPTY", 2L));
        document.put("tuningSuggestions", new ArrayList<>(List.of("Clustering quality looks good. No tuning needed.")));

        // When
        ClusterRunRecord run = FaceClusterDaoImpl.documentToRun(document);

        // Then
        assertEquals("run-1", run.getRunId());
        assertEquals(started, run.getStartedAt());
        assertNull(run.getFinishedAt());
        assertEquals(3, run.getMinSamples());
        assertEquals(2, run.getSkippedByReason().get("EMPTY"));
        assertEquals(1, run.getTuningSuggestions().size());
    }

    @Test
    public void testReplace_FirestoreDisabled_Throws() {
        FaceClusterDaoImpl dao = new FaceClusterDaoImpl();
        ClusterSet set = new ClusterSet("family", "run-1", new ArrayList<>(), new ArrayList<>(), new ClusterRunRecord());

        assertThrows(IllegalStateException.class, () -> dao.replaceClusterSet(set));
    }
}
