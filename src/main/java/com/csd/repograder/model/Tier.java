package com.csd.repograder.model;

public enum Tier {
    BRONZE("Bronze"),
    SILVER("Silver"),
    GOLD("Gold"),
    PLATINUM("Platinum");

    private final String label;

    Tier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Tier fromPercentage(double percentage) {
        if (percentage >= 90) return PLATINUM;
        if (percentage >= 75) return GOLD;
        if (percentage >= 60) return SILVER;
        return BRONZE;
    }
}
