package com.example.faceclusters.model;

/**
 * Human-readable quality band shared by face and clustering scores.
 */
public enum QualityLabel {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor");

    private final String displayName;

    QualityLabel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maps a 0-100 score onto the bands; each bound is inclusive on its lower edge.
     */
    public static QualityLabel forScore(double score, double excellentMin, double goodMin, double fairMin) {
        if (score >= excellentMin) {
            return EXCELLENT;
        } else if (score >= goodMin) {
            return GOOD;
        } else if (score >= fairMin) {
            return FAIR;
        }
        return POOR;
    }

    public static QualityLabel forScore(double score) {
        return forScore(score, 80.0, 60.0, 40.0);
    }
}
