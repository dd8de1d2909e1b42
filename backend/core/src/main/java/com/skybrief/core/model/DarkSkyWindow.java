package com.skybrief.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record DarkSkyWindow(Instant start, Instant end) {
    public DarkSkyWindow {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Dark window ends before it starts");
        }
    }

    public Instant bestViewingTime() {
        return start.plus(duration().dividedBy(2));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
