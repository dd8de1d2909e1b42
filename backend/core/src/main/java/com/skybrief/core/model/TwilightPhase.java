package com.skybrief.core.model;

public enum TwilightPhase {
    DAY("Daylight"),
    CIVIL("Civil twilight"),
    NAUTICAL("Nautical twilight"),
    ASTRONOMICAL("Astronomical twilight"),
    NIGHT("Astronomical night");

    private final String label;

    TwilightPhase(String label) {
        this.label = label;
    }

    public static TwilightPhase fromSolarAltitude(double altitudeDegrees) {
        if (altitudeDegrees >= 0.0) {
            return DAY;
        }
        if (altitudeDegrees >= -6.0) {
            return CIVIL;
        }
        if (altitudeDegrees >= -12.0) {
            return NAUTICAL;
        }
        if (altitudeDegrees >= -18.0) {
            return ASTRONOMICAL;
        }
        return NIGHT;
    }

    public String label() {
        return label;
    }
}
