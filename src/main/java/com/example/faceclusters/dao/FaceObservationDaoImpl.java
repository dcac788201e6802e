package com.example.faceclusters.dao;

import com.example.faceclusters.model.BoundingBox;
import com.example.faceclusters.model.FaceObservation;
import com.google.cloud.firestore.Blob;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Reads the detection pipeline's output. This engine never writes observations.
 */
@Repository
public class FaceObservationDaoImpl implements FaceObservationDao {

    private static final Logger log = LoggerFactory.getLogger(FaceObservationDaoImpl.class);

    static final String COLLECTION_NAME = "face_observations";

    @Autowired(required = false)
    private Firestore db;

    private void checkFirestore() {
        if (db == null) {
            throw new IllegalStateException("Firestore is not available in development mode. Please configure Firebase credentials.");
        }
    }

    @Override
    public List<FaceObservation> findWithEmbeddings(String collectionId) {
        checkFirestore();
        try {
            QuerySnapshot snapshot = db.collection(COLLECTION_NAME)
                .whereEqualTo("collectionId", collectionId)
                .get()
                .get();

            List<FaceObservation> observations = new ArrayList<>();
            for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
                if (document.get("embedding") == null) {
                    continue;
                }
                observations.add(documentToObservation(document.getId(), document.getData()));
            }
            log.debug("Loaded {} observations with embeddings for collection {}", observations.size(), collectionId);
            return observations;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FaceStoreException("Interrupted while loading face observations for " + collectionId, e);
        } catch (ExecutionException e) {
            throw new FaceStoreException("Failed to load face observations for " + collectionId, e);
        }
    }

    static FaceObservation documentToObservation(String id, Map<String, Object> data) {
        FaceObservation observation = new FaceObservation();
        observation.setId(id);
        observation.setCollectionId((String) data.get("collectionId"));
        observation.setSourceImagePath((String) data.get("sourceImagePath"));
        observation.setCropPath((String) data.get("cropPath"));
        observation.setDetectorConfidence(asDouble(data.get("detectorConfidence")));

        Object box = data.get("boundingBox");
        if (box instanceof Map<?, ?> boxMap) {
            observation.setBoundingBox(new BoundingBox(
                asDouble(boxMap.get("x")), asDouble(boxMap.get("y")),
                asDouble(boxMap.get("width")), asDouble(boxMap.get("height"))));
        }

        // Stored as a Firestore Blob; tolerate a raw byte array too
        Object embedding = data.get("embedding");
        if (embedding instanceof Blob blob) {
            observation.setEmbedding(blob.toBytes());
        } else if (embedding instanceof byte[] bytes) {
            observation.setEmbedding(bytes);
        }

        Object dimension = data.get("embeddingDimension");
        if (dimension instanceof Number n) {
            observation.setEmbeddingDimension(n.intValue());
        }
        return observation;
    }

    private static double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
