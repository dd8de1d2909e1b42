package com.skybrief.core.model;

public enum ViewingWindow {
    MORNING("Morning sky, before sunrise"),
    EVENING("Evening sky, after sunset"),
    ALL_NIGHT("Visible most of the night"),
    NOT_VISIBLE("Too close to the Sun");

    private final String label;

    ViewingWindow(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
