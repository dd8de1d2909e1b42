package com.skybrief.calculators.api;

import com.skybrief.core.model.GeoLocation;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

public record CalculationContext(
        GeoLocation location,
        ZonedDateTime at,
        JsonFetcher fetcher,
        Duration requestTimeout
) {
    public CalculationContext {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(at, "at is required");
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
    }

    public Instant instant() {
        return at.toInstant();
    }

    // Calendar days follow the location, never the zone the instant was written in.
    public ZoneOffset localOffset() {
        return location.localOffset();
    }

    public LocalDate localDate() {
        return LocalDate.ofInstant(instant(), localOffset());
    }

    public ZonedDateTime localStartOfDay() {
        return localDate().atStartOfDay(localOffset());
    }

    public double latitude() {
        return location.latitude();
    }

    public double longitude() {
        return location.longitude();
    }
}
