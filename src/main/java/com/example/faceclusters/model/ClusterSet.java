package com.example.faceclusters.model;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * The complete cluster assignment of a collection as produced by one run.
 * Always written and replaced as a whole.
 */
public class ClusterSet {
    private String collectionId;
    private String generationId;            // id of the run that produced the set
    private Date createdAt;
    private List<FaceCluster> clusters = new ArrayList<>();
    private List<String> unidentifiedIds = new ArrayList<>();   // noise observations
    private ClusterRunRecord run;

    public ClusterSet() {}

    public ClusterSet(String collectionId, String generationId, List<FaceCluster> clusters,
                      List<String> unidentifiedIds, ClusterRunRecord run) {
        this.collectionId = collectionId;
        this.generationId = generationId;
        this.createdAt = new Date();
        this.clusters = clusters;
        this.unidentifiedIds = unidentifiedIds;
        this.run = run;
    }

    // Getters and Setters
    public String getCollectionId() { return collectionId; }
    public void setCollectionId(String collectionId) { this.collectionId = collectionId; }

    public String getGenerationId() { return generationId; }
    public void setGenerationId(String generationId) { this.generationId = generationId; }

    public Date getCreatedAt() { return createdAt; }
    public void setCreatedAt(Date createdAt) { this.createdAt = createdAt; }

    public List<FaceCluster> getClusters() { return clusters; }
    public void setClusters(List<FaceCluster> clusters) { this.clusters = clusters; }

    public List<String> getUnidentifiedIds() { return unidentifiedIds; }
    public void setUnidentifiedIds(List<String> unidentifiedIds) { this.unidentifiedIds = unidentifiedIds; }

    public ClusterRunRecord getRun() { return run; }
    public void setRun(ClusterRunRecord run) { this.run = run; }
}
