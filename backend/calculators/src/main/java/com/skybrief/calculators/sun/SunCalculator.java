package com.skybrief.calculators.sun;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.astro.SolarMath;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.HorizonEvent;
import com.skybrief.core.model.SunTimes;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

public class SunCalculator implements Calculator<SunTimes> {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.sunrise-sunset.org/json");

    // The provider reports events that never happen as the Unix epoch.
    private static final int NON_EVENT_YEAR = 1970;

    private final URI endpoint;

    public SunCalculator() {
        this(DEFAULT_ENDPOINT);
    }

    public SunCalculator(URI endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
    }

    @Override
    public Domain domain() {
        return Domain.SUN;
    }

    @Override
    public boolean hasLiveSource() {
        return true;
    }

    @Override
    public boolean hasLocalFallback() {
        return true;
    }

    @Override
    public SunTimes computeLive(CalculationContext ctx) throws SourceException {
        LocalDate date = ctx.localDate();
        URI uri = LivePayloads.withQuery(endpoint,
                "lat", Double.toString(ctx.latitude()),
                "lng", Double.toString(ctx.longitude()),
                "date", date.toString(),
                "formatted", "0");
        JsonNode root = LivePayloads.fetchTree(ctx, uri);
        String status = LivePayloads.requiredText(root, "status");
        if (!"OK".equals(status)) {
            throw SourceException.malformed("Sun times provider returned status " + status);
        }
        JsonNode results = LivePayloads.requiredNode(root, "results");

        Instant solarNoon = parseTime(results, "solar_noon");
        if (solarNoon == null) {
            throw SourceException.malformed("Solar noon reported as a non-event");
        }
        double transitAltitude = SolarMath.altitude(ctx.latitude(), ctx.longitude(), solarNoon);
        SunTimes times = new SunTimes(
                date,
                solarNoon,
                event(results, "astronomical_twilight_begin", transitAltitude, SolarMath.ASTRONOMICAL_ALTITUDE),
                event(results, "nautical_twilight_begin", transitAltitude, SolarMath.NAUTICAL_ALTITUDE),
                event(results, "civil_twilight_begin", transitAltitude, SolarMath.CIVIL_ALTITUDE),
                event(results, "sunrise", transitAltitude, SolarMath.SUNRISE_ALTITUDE),
                event(results, "sunset", transitAltitude, SolarMath.SUNRISE_ALTITUDE),
                event(results, "civil_twilight_end", transitAltitude, SolarMath.CIVIL_ALTITUDE),
                event(results, "nautical_twilight_end", transitAltitude, SolarMath.NAUTICAL_ALTITUDE),
                event(results, "astronomical_twilight_end", transitAltitude, SolarMath.ASTRONOMICAL_ALTITUDE)
        );
        if (!times.isOrdered()) {
            throw SourceException.malformed("Sun events out of order for " + date);
        }
        return times;
    }

    @Override
    public SunTimes computeLocal(CalculationContext ctx) {
        return SolarMath.sunTimes(ctx.localDate(), ctx.latitude(), ctx.longitude());
    }

    // A missing crossing is always-above when the sun at transit clears the threshold.
    private static HorizonEvent event(JsonNode results, String field, double transitAltitude, double threshold)
            throws SourceException {
        Instant time = parseTime(results, field);
        if (time != null) {
            return HorizonEvent.occurs(time);
        }
        return transitAltitude > threshold ? HorizonEvent.alwaysAbove() : HorizonEvent.alwaysBelow();
    }

    private static Instant parseTime(JsonNode results, String field) throws SourceException {
        String text = LivePayloads.requiredText(results, field);
        try {
            OffsetDateTime time = OffsetDateTime.parse(text);
            return time.getYear() == NON_EVENT_YEAR ? null : time.toInstant();
        } catch (DateTimeParseException e) {
            throw SourceException.malformed("Invalid timestamp for '" + field + "': " + text);
        }
    }
}
