package com.example.faceclusters.dao;

import com.example.faceclusters.model.FaceObservation;

import java.util.List;

public interface FaceObservationDao {

    /**
     * All observations of a collection that carry an embedding (Firestore collection: face_observations).
     * @throws FaceStoreException if the store cannot be read
     */
    List<FaceObservation> findWithEmbeddings(String collectionId);
}
