package com.skybrief.calculators.spaceweather;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.SpaceWeather;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

public class SpaceWeatherCalculator implements Calculator<SpaceWeather> {
    private static final Logger LOGGER = Logger.getLogger(SpaceWeatherCalculator.class.getName());

    public static final URI DEFAULT_KP_ENDPOINT =
            URI.create("https://services.swpc.noaa.gov/products/noaa-planetary-k-index.json");
    public static final URI DEFAULT_FORECAST_ENDPOINT =
            URI.create("https://services.swpc.noaa.gov/products/noaa-planetary-k-index-forecast.json");
    public static final URI DEFAULT_PLASMA_ENDPOINT =
            URI.create("https://services.swpc.noaa.gov/products/solar-wind/plasma-7-day.json");

    static final int FORECAST_ENTRIES = 8;
    private static final Duration OBSERVED_WINDOW = Duration.ofHours(24);
    // Kp is published in 3-hour bins, so the latest row may trail the present by a few hours.
    static final Duration LAG_TOLERANCE = Duration.ofHours(6);
    static final Duration FORECAST_SPAN = Duration.ofHours(3L * FORECAST_ENTRIES);

    private final URI kpEndpoint;
    private final URI forecastEndpoint;
    private final URI plasmaEndpoint;

    public SpaceWeatherCalculator() {
        this(DEFAULT_KP_ENDPOINT, DEFAULT_FORECAST_ENDPOINT, DEFAULT_PLASMA_ENDPOINT);
    }

    public SpaceWeatherCalculator(URI kpEndpoint, URI forecastEndpoint, URI plasmaEndpoint) {
        this.kpEndpoint = Objects.requireNonNull(kpEndpoint, "kpEndpoint is required");
        this.forecastEndpoint = forecastEndpoint;
        this.plasmaEndpoint = plasmaEndpoint;
    }

    @Override
    public Domain domain() {
        return Domain.SPACE_WEATHER;
    }

    @Override
    public boolean hasLiveSource() {
        return true;
    }

    @Override
    public boolean hasLocalFallback() {
        return false;
    }

    // Only the Kp feed is required; forecast and solar wind enrich the result when they answer.
    @Override
    public SpaceWeather computeLive(CalculationContext ctx) throws SourceException {
        SwpcTable kpTable = SwpcTable.parse(LivePayloads.fetchTree(ctx, kpEndpoint));
        if (kpTable.isEmpty()) {
            throw SourceException.malformed("Kp feed has no observations");
        }
        List<Map<String, JsonNode>> rows = kpTable.rows();
        Map<String, JsonNode> latest = rows.get(rows.size() - 1);
        Instant observedAt = SwpcTable.time(latest);
        requireCovers(observedAt, ctx.instant());
        double kp = kpValue(latest);

        double kpMax = kp;
        for (Map<String, JsonNode> row : rows) {
            if (!SwpcTable.time(row).isBefore(observedAt.minus(OBSERVED_WINDOW))) {
                kpMax = Math.max(kpMax, kpValue(row));
            }
        }
        Double forecastMax = forecastMax(ctx, observedAt);
        if (forecastMax != null) {
            kpMax = Math.max(kpMax, forecastMax);
        }

        SolarWind wind = latestSolarWind(ctx);
        return SpaceWeather.of(kp, kpMax, wind.speed(), wind.density(), ctx.latitude(), observedAt);
    }

    @Override
    public SpaceWeather computeLocal(CalculationContext ctx) {
        throw new UnsupportedOperationException("Space weather has no local model");
    }

    // The feed only describes the present; other instants must not be reported as current.
    static void requireCovers(Instant observedAt, Instant instant) throws SourceException {
        if (instant.isBefore(observedAt.minus(LAG_TOLERANCE)) || instant.isAfter(observedAt.plus(FORECAST_SPAN))) {
            throw new SourceException(FailureReason.STALE_DATA,
                    "Latest Kp observation " + observedAt + " does not cover " + instant);
        }
    }

    private static double kpValue(Map<String, JsonNode> row) throws SourceException {
        Double kp = SwpcTable.number(row, "kp");
        if (kp == null) {
            throw SourceException.malformed("Kp row without a value");
        }
        return LivePayloads.inRange(kp, 0.0, 9.0, "kp");
    }

    private Double forecastMax(CalculationContext ctx, Instant observedAt) {
        if (forecastEndpoint == null) {
            return null;
        }
        try {
            SwpcTable table = SwpcTable.parse(LivePayloads.fetchTree(ctx, forecastEndpoint));
            Double max = null;
            int taken = 0;
            for (Map<String, JsonNode> row : table.rows()) {
                if (taken >= FORECAST_ENTRIES) {
                    break;
                }
                if (SwpcTable.time(row).isAfter(observedAt)) {
                    double kp = kpValue(row);
                    max = max == null ? kp : Math.max(max, kp);
                    taken++;
                }
            }
            return max;
        } catch (SourceException e) {
            LOGGER.fine(() -> "Kp forecast ignored: " + e.getMessage());
            return null;
        }
    }

    private SolarWind latestSolarWind(CalculationContext ctx) {
        if (plasmaEndpoint == null) {
            return SolarWind.UNKNOWN;
        }
        try {
            List<Map<String, JsonNode>> rows = SwpcTable.parse(LivePayloads.fetchTree(ctx, plasmaEndpoint)).rows();
            for (int i = rows.size() - 1; i >= 0; i--) {
                Double speed = SwpcTable.number(rows.get(i), "speed");
                if (speed != null) {
                    return new SolarWind(speed, SwpcTable.number(rows.get(i), "density"));
                }
            }
            return SolarWind.UNKNOWN;
        } catch (SourceException e) {
            LOGGER.fine(() -> "Solar wind ignored: " + e.getMessage());
            return SolarWind.UNKNOWN;
        }
    }

    private record SolarWind(Double speed, Double density) {
        static final SolarWind UNKNOWN = new SolarWind(null, null);
    }
}
