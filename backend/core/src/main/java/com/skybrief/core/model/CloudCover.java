package com.skybrief.core.model;

public record CloudCover(double percentAtInstant, Double nightAveragePercent, Double nightMinimumPercent) {
    public CloudCover {
        if (Double.isNaN(percentAtInstant) || percentAtInstant < 0 || percentAtInstant > 100) {
            throw new IllegalArgumentException("cloud cover must be within [0, 100]: " + percentAtInstant);
        }
    }

    public String description() {
        return describe(percentAtInstant);
    }

    public static String describe(double percent) {
        if (percent < 25) {
            return "Clear skies";
        }
        if (percent < 50) {
            return "Partly cloudy";
        }
        if (percent < 75) {
            return "Mostly cloudy";
        }
        return "Overcast";
    }
}
