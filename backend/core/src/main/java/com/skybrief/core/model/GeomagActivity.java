package com.skybrief.core.model;

public enum GeomagActivity {
    QUIET("Quiet", "Quiet conditions, aurora unlikely except at high latitudes"),
    UNSETTLED("Unsettled", "Unsettled conditions, aurora possible at high latitudes"),
    ACTIVE("Active", "Active conditions, aurora likely at high latitudes"),
    MINOR_STORM("Minor Storm", "G1 minor storm, aurora visible at 60 degrees latitude and above"),
    MODERATE_STORM("Moderate Storm", "G2 moderate storm, aurora visible at 55 degrees latitude and above"),
    STRONG_STORM("Strong Storm", "G3 strong storm, aurora visible at 50 degrees latitude and above"),
    SEVERE_STORM("Severe Storm", "G4 severe storm, aurora visible at 45 degrees latitude and above"),
    EXTREME_STORM("Extreme Storm", "G5 extreme storm, aurora visible at 40 degrees latitude and above");

    private final String label;
    private final String description;

    GeomagActivity(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public static GeomagActivity fromKp(double kp) {
        if (kp < 2) {
            return QUIET;
        }
        if (kp < 4) {
            return UNSETTLED;
        }
        if (kp < 5) {
            return ACTIVE;
        }
        if (kp < 6) {
            return MINOR_STORM;
        }
        if (kp < 7) {
            return MODERATE_STORM;
        }
        if (kp < 8) {
            return STRONG_STORM;
        }
        if (kp < 9) {
            return SEVERE_STORM;
        }
        return EXTREME_STORM;
    }
}
