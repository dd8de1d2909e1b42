package com.skybrief.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One optically visible pass of the International Space Station. Directions are 16-point compass
 * labels as reported by the provider.
 */
public record IssPass(
        Instant start,
        Instant peak,
        Instant end,
        double maxElevation,
        String startDirection,
        String endDirection,
        Double magnitude
) {
    public IssPass {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(peak, "peak is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start) || peak.isBefore(start) || peak.isAfter(end)) {
            throw new IllegalArgumentException("Pass times out of order: " + start + " / " + peak + " / " + end);
        }
        if (maxElevation < 0 || maxElevation > 90) {
            throw new IllegalArgumentException("maxElevation must be within [0, 90]: " + maxElevation);
        }
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean startsWithin(Instant from, Instant until) {
        return !start.isBefore(from) && start.isBefore(until);
    }
}
