package com.skybrief.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A rise, set or twilight crossing. Only {@link Kind#OCCURS} carries a time; "does not occur"
 * (ALWAYS_ABOVE / ALWAYS_BELOW) is kept apart from "not in this window" and "not computed".
 */
public record HorizonEvent(Kind kind, Instant time) {
    public enum Kind {
        OCCURS,
        ALWAYS_ABOVE,
        ALWAYS_BELOW,
        NOT_IN_WINDOW,
        NOT_COMPUTED
    }

    private static final HorizonEvent ALWAYS_ABOVE = new HorizonEvent(Kind.ALWAYS_ABOVE, null);
    private static final HorizonEvent ALWAYS_BELOW = new HorizonEvent(Kind.ALWAYS_BELOW, null);
    private static final HorizonEvent NOT_IN_WINDOW = new HorizonEvent(Kind.NOT_IN_WINDOW, null);
    private static final HorizonEvent NOT_COMPUTED = new HorizonEvent(Kind.NOT_COMPUTED, null);

    public HorizonEvent {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == Kind.OCCURS && time == null) {
            throw new IllegalArgumentException("An occurring event needs a time");
        }
        if (kind != Kind.OCCURS && time != null) {
            throw new IllegalArgumentException(kind + " must not carry a time");
        }
    }

    public static HorizonEvent occurs(Instant time) {
        return new HorizonEvent(Kind.OCCURS, Objects.requireNonNull(time, "time is required"));
    }

    public static HorizonEvent alwaysAbove() {
        return ALWAYS_ABOVE;
    }

    public static HorizonEvent alwaysBelow() {
        return ALWAYS_BELOW;
    }

    public static HorizonEvent notInWindow() {
        return NOT_IN_WINDOW;
    }

    public static HorizonEvent notComputed() {
        return NOT_COMPUTED;
    }

    public boolean occurs() {
        return kind == Kind.OCCURS;
    }
}
