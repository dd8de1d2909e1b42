package com.skybrief.calculators.planets;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.astro.PlanetMath;
import com.skybrief.core.astro.PlanetPosition;
import com.skybrief.core.astro.RiseSet;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.Planet;
import com.skybrief.core.model.PlanetVisibility;
import com.skybrief.core.model.ViewingWindow;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class PlanetCalculator implements Calculator<List<PlanetVisibility>> {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.visibleplanets.dev/v3");

    private final URI endpoint;

    public PlanetCalculator() {
        this(DEFAULT_ENDPOINT);
    }

    public PlanetCalculator(URI endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
    }

    @Override
    public Domain domain() {
        return Domain.PLANETS;
    }

    @Override
    public boolean hasLiveSource() {
        return true;
    }

    @Override
    public boolean hasLocalFallback() {
        return true;
    }

    // Provider altitude and magnitude override the local estimates; bodies it omits keep local values.
    @Override
    public List<PlanetVisibility> computeLive(CalculationContext ctx) throws SourceException {
        URI uri = LivePayloads.withQuery(endpoint,
                "latitude", Double.toString(ctx.latitude()),
                "longitude", Double.toString(ctx.longitude()),
                "time", DateTimeFormatter.ISO_INSTANT.format(ctx.instant()));
        JsonNode data = LivePayloads.requiredNode(LivePayloads.fetchTree(ctx, uri), "data");
        if (!data.isArray()) {
            throw SourceException.malformed("Planet data is not an array");
        }

        Map<Planet, LiveReading> readings = new EnumMap<>(Planet.class);
        for (JsonNode body : data) {
            Optional<Planet> planet = Planet.fromName(body.path("name").asText(""));
            if (planet.isEmpty()) {
                continue;
            }
            double altitude = LivePayloads.inRange(LivePayloads.requiredDouble(body, "altitude"), -90.0, 90.0, "altitude");
            Double magnitude = LivePayloads.optionalDouble(body, "magnitude");
            readings.put(planet.get(), new LiveReading(altitude, magnitude));
        }
        if (readings.isEmpty()) {
            throw SourceException.malformed("Planet payload lists no tracked planets");
        }

        List<PlanetVisibility> result = new ArrayList<>();
        for (Planet planet : Planet.values()) {
            LiveReading reading = readings.get(planet);
            if (reading == null) {
                result.add(local(ctx, planet));
            } else {
                result.add(visibility(ctx, planet, reading.altitude(), reading.magnitude()));
            }
        }
        return List.copyOf(result);
    }

    @Override
    public List<PlanetVisibility> computeLocal(CalculationContext ctx) {
        List<PlanetVisibility> result = new ArrayList<>();
        for (Planet planet : Planet.values()) {
            result.add(local(ctx, planet));
        }
        return List.copyOf(result);
    }

    private PlanetVisibility local(CalculationContext ctx, Planet planet) {
        double altitude = PlanetMath.altitude(planet, ctx.latitude(), ctx.longitude(), ctx.instant());
        return visibility(ctx, planet, altitude, null);
    }

    private PlanetVisibility visibility(CalculationContext ctx, Planet planet, double altitude, Double liveMagnitude) {
        Instant instant = ctx.instant();
        PlanetPosition position = PlanetMath.position(planet, instant);
        double magnitude = liveMagnitude != null ? liveMagnitude : position.magnitude();
        ViewingWindow window = PlanetMath.windowFor(position.elongation(), magnitude, position.eastOfSun());
        RiseSet riseSet = PlanetMath.riseAndSet(
                planet,
                ctx.latitude(),
                ctx.longitude(),
                ctx.localStartOfDay().toInstant(),
                ctx.localStartOfDay().plusDays(1).toInstant()
        );
        return new PlanetVisibility(
                planet,
                window != ViewingWindow.NOT_VISIBLE,
                window,
                magnitude,
                position.elongation(),
                altitude,
                riseSet.rise(),
                riseSet.set(),
                PlanetMath.bestViewingHint(window, position.elongation())
        );
    }

    private record LiveReading(double altitude, Double magnitude) {
    }
}
