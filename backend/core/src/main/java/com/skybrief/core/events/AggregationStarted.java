package com.skybrief.core.events;

import java.time.Instant;
import java.time.ZonedDateTime;

public record AggregationStarted(
        Instant timestamp,
        double latitude,
        double longitude,
        ZonedDateTime calculationInstant,
        int domains
) implements Event {
    @Override
    public String type() {
        return "AggregationStarted";
    }
}
