package com.skybrief.core.model;

public enum Domain {
    MOON("moon", "Moon"),
    SUN("sun", "Sun times"),
    PLANETS("planets", "Planets"),
    METEOR_SHOWERS("meteor_showers", "Meteor showers"),
    ECLIPSES("eclipses", "Eclipses"),
    SPACE_WEATHER("space_weather", "Space weather"),
    WEATHER("weather", "Cloud cover"),
    ISS_PASSES("iss_passes", "ISS passes");

    private final String key;
    private final String label;

    Domain(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }
}
