package com.csd.repograder.model;

public enum SkillLevel {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    ADVANCED("Advanced"),
    EXPERT("Expert");

    private final String label;

    SkillLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static SkillLevel fromPercentage(double percentage) {
        if (percentage >= 85) return EXPERT;
        if (percentage >= 70) return ADVANCED;
        if (percentage >= 50) return INTERMEDIATE;
        return BEGINNER;
    }
}
