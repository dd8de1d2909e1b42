package com.skybrief.calculators.support;

import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.JsonFetcher;
import com.skybrief.core.model.GeoLocation;

import java.time.Duration;
import java.time.ZonedDateTime;

public final class Contexts {
    public static final GeoLocation NEW_YORK = GeoLocation.of(40.7128, -74.006);

    private Contexts() {
    }

    public static CalculationContext at(GeoLocation location, String zonedDateTime, JsonFetcher fetcher) {
        return new CalculationContext(location, ZonedDateTime.parse(zonedDateTime), fetcher, Duration.ofSeconds(2));
    }

    public static CalculationContext newYork(String zonedDateTime, JsonFetcher fetcher) {
        return at(NEW_YORK, zonedDateTime, fetcher);
    }
}
