package com.skybrief.core.model;

public enum ScoreFactor {
    CLOUD_COVER("cloud_cover", 50),
    MOON("moon", 35),
    GEOMAGNETIC("geomagnetic", 15);

    private final String key;
    private final int weight;

    ScoreFactor(String key, int weight) {
        this.key = key;
        this.weight = weight;
    }

    public String key() {
        return key;
    }

    public int weight() {
        return weight;
    }
}
