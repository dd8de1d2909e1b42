package com.skybrief.core.model;

import java.time.Instant;
import java.util.Objects;

public record MoonState(
        MoonPhase phase,
        double illumination,
        double ageDays,
        double phaseAngle,
        Double altitudeDegrees,
        HorizonEvent rise,
        HorizonEvent set,
        Instant nextNewMoon,
        Instant nextFullMoon
) {
    public MoonState {
        Objects.requireNonNull(phase, "phase is required");
        Objects.requireNonNull(rise, "rise is required");
        Objects.requireNonNull(set, "set is required");
        if (Double.isNaN(illumination) || illumination < 0.0 || illumination > 1.0) {
            throw new IllegalArgumentException("illumination must be within [0,1]: " + illumination);
        }
    }

    public int illuminationPercent() {
        return (int) Math.round(illumination * 100.0);
    }

    // Unknown altitude counts as up.
    public boolean isUp() {
        return altitudeDegrees == null || altitudeDegrees > 0.0;
    }
}
