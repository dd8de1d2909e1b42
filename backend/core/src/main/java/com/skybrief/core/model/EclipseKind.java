package com.skybrief.core.model;

public enum EclipseKind {
    TOTAL_SOLAR("Total Solar Eclipse"),
    PARTIAL_SOLAR("Partial Solar Eclipse"),
    ANNULAR_SOLAR("Annular Solar Eclipse"),
    HYBRID_SOLAR("Hybrid Solar Eclipse"),
    TOTAL_LUNAR("Total Lunar Eclipse"),
    PARTIAL_LUNAR("Partial Lunar Eclipse"),
    PENUMBRAL_LUNAR("Penumbral Lunar Eclipse");

    private final String label;

    EclipseKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isSolar() {
        return name().endsWith("_SOLAR");
    }

    public boolean isLunar() {
        return name().endsWith("_LUNAR");
    }
}
