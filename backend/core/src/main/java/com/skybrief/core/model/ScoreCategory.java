package com.skybrief.core.model;

public enum ScoreCategory {
    POOR("Poor", 0, 39),
    FAIR("Fair", 40, 59),
    GOOD("Good", 60, 79),
    EXCELLENT("Excellent", 80, 100);

    private final String label;
    private final int min;
    private final int max;

    ScoreCategory(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public static ScoreCategory fromScore(int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within [0, 100]: " + score);
        }
        for (ScoreCategory category : values()) {
            if (score >= category.min && score <= category.max) {
                return category;
            }
        }
        throw new IllegalStateException("No category covers " + score);
    }
}
