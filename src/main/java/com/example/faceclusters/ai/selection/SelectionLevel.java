package com.example.faceclusters.ai.selection;

/**
 * Representative selection levels, tried in ascending order.
 */
public enum SelectionLevel {
    QUALITY_WEIGHTED(1),
    BASIC_THRESHOLD(2),
    CENTROID_PROXIMITY(3),
    FIRST_MEMBER(4);

    private final int level;

    SelectionLevel(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
