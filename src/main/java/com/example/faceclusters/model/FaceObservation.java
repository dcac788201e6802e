package com.example.faceclusters.model;

/**
 * One detected face instance as produced by the detection pipeline.
 * Read-only to the clustering engine.
 */
public class FaceObservation {
    private String id;
    private String collectionId;
    private String sourceImagePath;
    private String cropPath;
    private BoundingBox boundingBox;
    private double detectorConfidence;
    private byte[] embedding;
    private int embeddingDimension;

    public FaceObservation() {}

    public FaceObservation(String id, String collectionId, String sourceImagePath, String cropPath,
                           BoundingBox boundingBox, double detectorConfidence,
                           byte[] embedding, int embeddingDimension) {
        this.id = id;
        this.collectionId = collectionId;
        this.sourceImagePath = sourceImagePath;
        this.cropPath = cropPath;
        this.boundingBox = boundingBox;
        this.detectorConfidence = detectorConfidence;
        this.embedding = embedding;
        this.embeddingDimension = embeddingDimension;
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCollectionId() { return collectionId; }
    public void setCollectionId(String collectionId) { this.collectionId = collectionId; }

    public String getSourceImagePath() { return sourceImagePath; }
    public void setSourceImagePath(String sourceImagePath) { this.sourceImagePath = sourceImagePath; }

    public String getCropPath() { return cropPath; }
    public void setCropPath(String cropPath) { this.cropPath = cropPath; }

    public BoundingBox getBoundingBox() { return boundingBox; }
    public void setBoundingBox(BoundingBox boundingBox) { this.boundingBox = boundingBox; }

    public double getDetectorConfidence() { return detectorConfidence; }
    public void setDetectorConfidence(double detectorConfidence) { this.detectorConfidence = detectorConfidence; }

    public byte[] getEmbedding() { return embedding; }
    public void setEmbedding(byte[] embedding) { this.embedding = embedding; }

    public int getEmbeddingDimension() { return embeddingDimension; }
    public void setEmbeddingDimension(int embeddingDimension) { this.embeddingDimension = embeddingDimension; }

    @Override
    public String toString() {
        return "FaceObservation{id='" + id + "', collectionId='" + collectionId
                + "', sourceImagePath='" + sourceImagePath + "'}";
    }
}
