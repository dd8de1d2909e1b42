package com.skybrief.core.model;

import java.util.Objects;

public record PlanetVisibility(
        Planet planet,
        boolean visible,
        ViewingWindow window,
        double magnitude,
        double elongation,
        Double altitudeDegrees,
        HorizonEvent rise,
        HorizonEvent set,
        String bestViewing
) {
    public PlanetVisibility {
        Objects.requireNonNull(planet, "planet is required");
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(rise, "rise is required");
        Objects.requireNonNull(set, "set is required");
        if (visible && window == ViewingWindow.NOT_VISIBLE) {
            throw new IllegalArgumentException(planet + " cannot be visible with window NOT_VISIBLE");
        }
    }

    public String brightness() {
        if (magnitude < -3) {
            return "Very Bright";
        }
        if (magnitude < -1) {
            return "Bright";
        }
        if (magnitude < 1) {
            return "Moderate";
        }
        return "Dim";
    }
}
