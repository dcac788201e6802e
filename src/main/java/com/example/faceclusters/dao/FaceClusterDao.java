package com.example.faceclusters.dao;

import com.example.faceclusters.model.ClusterRunRecord;
import com.example.faceclusters.model.ClusterSet;

import java.util.List;
import java.util.Optional;

public interface FaceClusterDao {

    /**
     * Replaces the collection's cluster set and stores the run record with it.
     * Readers see either the previous set or the new one, never a mix.
     * @throws FaceStoreException if the new set could not be committed; the previous set stays current
     */
    void replaceClusterSet(ClusterSet clusterSet);

    Optional<ClusterSet> findCurrent(String collectionId);

    // Most recent first
    List<ClusterRunRecord> findRecentRuns(String collectionId, int limit);
}
