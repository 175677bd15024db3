package com.csd.repograder.model;

/**
 * The six scored quality axes, in evaluation order. The max scores add up to 100.
 */
public enum DimensionType {
    CODE_QUALITY("Code Quality", 20),
    PROJECT_STRUCTURE("Project Structure", 15),
    DOCUMENTATION("Documentation", 25),
    TESTING("Testing", 15),
    REAL_WORLD_RELEVANCE("Real-World Relevance", 10),
    DEVELOPMENT_PRACTICES("Development Practices", 15);

    private final String displayName;
    private final int maxScore;

    DimensionType(String displayName, int maxScore) {
        this.displayName = displayName;
        this.maxScore = maxScore;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getMaxScore() {
        return maxScore;
    }
}
