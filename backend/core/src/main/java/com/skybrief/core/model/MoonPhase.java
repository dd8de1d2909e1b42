package com.skybrief.core.model;

import java.util.Locale;
import java.util.Optional;

public enum MoonPhase {
    NEW("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent");

    private final String label;

    MoonPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MoonPhase fromBucket(int bucket) {
        return values()[Math.floorMod(bucket, values().length)];
    }

    public static Optional<MoonPhase> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        for (MoonPhase phase : values()) {
            String label = phase.label.toLowerCase(Locale.ROOT);
            if (label.equals(normalized) || label.replace(" moon", "").equals(normalized)) {
                return Optional.of(phase);
            }
        }
        if (normalized.equals("third quarter")) {
            return Optional.of(LAST_QUARTER);
        }
        return Optional.empty();
    }
}
