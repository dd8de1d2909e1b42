package com.skybrief.core.events;

import java.time.Instant;

public record AggregationCompleted(
        Instant timestamp,
        int live,
        int fallback,
        int unavailable,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "AggregationCompleted";
    }
}
