package org.carball.cfgaudit.model.analysis;

import lombok.Getter;

@Getter
public enum RiskRating {
    LOW("Low Risk", "green", 10, "Good, maintainable code"),
    MODERATE("Moderate Risk", "orange", 20, "Consider refactoring complex functions"),
    HIGH("High Risk", "red", 50, "Definitely refactor, hard to test"),
    VERY_HIGH("Very High Risk", "darkred", Integer.MAX_VALUE, "Immediate refactoring needed");

    private final String displayName;
    private final String color;
    private final int maxComplexity;
    private final String recommendation;

    RiskRating(String displayName, String color, int maxComplexity, String recommendation) {
        this.displayName = displayName;
        this.color = color;
        this.maxComplexity = maxComplexity;
        this.recommendation = recommendation;
    }

    /**
     * Bands are inclusive on their upper bound and checked in ascending order.
     */
    public static RiskRating fromComplexity(int complexity) {
        if (complexity <= LOW.maxComplexity) {
            return LOW;
        } else if (complexity <= MODERATE.maxComplexity) {
            return MODERATE;
        } else if (complexity <= HIGH.maxComplexity) {
            return HIGH;
        } else {
            return VERY_HIGH;
        }
    }

    /**
     * Human readable range, e.g. "11-20" or "51+".
     */
    public String getRange() {
        int lower = switch (this) {
            case LOW -> 1;
            case MODERATE -> LOW.maxComplexity + 1;
            case HIGH -> MODERATE.maxComplexity + 1;
            case VERY_HIGH -> HIGH.maxComplexity + 1;
        };
        return this == VERY_HIGH ? lower + "+" : lower + "-" + maxComplexity;
    }
}
