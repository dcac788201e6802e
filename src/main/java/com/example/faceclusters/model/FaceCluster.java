package com.example.faceclusters.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One person-identity cluster inside a collection.
 * Members exclude noise; every member belongs to exactly one cluster of a set.
 */
public class FaceCluster {
    private String clusterKey;              // face_001, face_002, ... by descending size
    private String collectionId;
    private String displayName;             // "Person 1", "Person 2", ...
    private List<String> memberIds = new ArrayList<>();
    private int photoCount;                 // distinct source images among members
    private byte[] centroid;                // little-endian float32
    private String representativeId;
    private int representativeLevel;        // fallback level that picked the representative, 1-4
    private Map<String, Object> representativeQuality = new LinkedHashMap<>();
    private Map<String, Object> qualitySnapshot = new LinkedHashMap<>();

    public FaceCluster() {}

    // Getters and Setters
    public String getClusterKey() { return clusterKey; }
    public void setClusterKey(String clusterKey) { this.clusterKey = clusterKey; }

    public String getCollectionId() { return collectionId; }
    public void setCollectionId(String collectionId) { this.collectionId = collectionId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public List<String> getMemberIds() { return memberIds; }
    public void setMemberIds(List<String> memberIds) { this.memberIds = memberIds; }

    public int getPhotoCount() { return photoCount; }
    public void setPhotoCount(int photoCount) { this.photoCount = photoCount; }

    public byte[] getCentroid() { return centroid; }
    public void setCentroid(byte[] centroid) { this.centroid = centroid; }

    public String getRepresentativeId() { return representativeId; }
    public void setRepresentativeId(String representativeId) { this.representativeId = representativeId; }

    public int getRepresentativeLevel() { return representativeLevel; }
    public void setRepresentativeLevel(int representativeLevel) { this.representativeLevel = representativeLevel; }

    public Map<String, Object> getRepresentativeQuality() { return representativeQuality; }
    public void setRepresentativeQuality(Map<String, Object> representativeQuality) { this.representativeQuality = representativeQuality; }

    public Map<String, Object> getQualitySnapshot() { return qualitySnapshot; }
    public void setQualitySnapshot(Map<String, Object> qualitySnapshot) { this.qualitySnapshot = qualitySnapshot; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FaceCluster)) return false;
        FaceCluster that = (FaceCluster) o;
        return photoCount == that.photoCount
                && representativeLevel == that.representativeLevel
                && Objects.equals(clusterKey, that.clusterKey)
                && Objects.equals(collectionId, that.collectionId)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(memberIds, that.memberIds)
                && Arrays.equals(centroid, that.centroid)
                && Objects.equals(representativeId, that.representativeId)
                && Objects.equals(representativeQuality, that.representativeQuality)
                && Objects.equals(qualitySnapshot, that.qualitySnapshot);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(clusterKey, collectionId, displayName, memberIds, photoCount,
                representativeId, representativeLevel);
        return 31 * result + Arrays.hashCode(centroid);
    }

    @Override
    public String toString() {
        return "FaceCluster{clusterKey='" + clusterKey + "', displayName='" + displayName
                + "', members=" + memberIds.size() + ", representativeId='" + representativeId
                + "', level=" + representativeLevel + "}";
    }
}
