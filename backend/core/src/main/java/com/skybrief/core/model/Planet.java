package com.skybrief.core.model;

import java.util.Locale;
import java.util.Optional;

public enum Planet {
    MERCURY("Mercury", true),
    VENUS("Venus", true),
    MARS("Mars", false),
    JUPITER("Jupiter", false),
    SATURN("Saturn", false),
    URANUS("Uranus", false),
    NEPTUNE("Neptune", false);

    private final String displayName;
    private final boolean inner;

    Planet(String displayName, boolean inner) {
        this.displayName = displayName;
        this.inner = inner;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isInner() {
        return inner;
    }

    public static Optional<Planet> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Planet planet : values()) {
            if (planet.name().equals(normalized)) {
                return Optional.of(planet);
            }
        }
        return Optional.empty();
    }
}
