package com.skybrief.calculators.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.model.CloudCover;
import com.skybrief.core.model.Domain;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public class CloudCoverCalculator implements Calculator<CloudCover> {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.open-meteo.com/v1/forecast");

    private final URI endpoint;

    public CloudCoverCalculator() {
        this(DEFAULT_ENDPOINT);
    }

    public CloudCoverCalculator(URI endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
    }

    @Override
    public Domain domain() {
        return Domain.WEATHER;
    }

    @Override
    public boolean hasLiveSource() {
        return true;
    }

    @Override
    public boolean hasLocalFallback() {
        return false;
    }

    // Hours are requested in UTC; "tonight" runs from local noon to the next local noon.
    @Override
    public CloudCover computeLive(CalculationContext ctx) throws SourceException {
        LocalDate date = ctx.localDate();
        URI uri = LivePayloads.withQuery(endpoint,
                "latitude", Double.toString(ctx.latitude()),
                "longitude", Double.toString(ctx.longitude()),
                "hourly", "cloud_cover,is_day",
                "timezone", "UTC",
                "start_date", date.minusDays(1).toString(),
                "end_date", date.plusDays(1).toString());
        JsonNode hourly = LivePayloads.requiredNode(LivePayloads.fetchTree(ctx, uri), "hourly");
        JsonNode times = LivePayloads.requiredNode(hourly, "time");
        JsonNode cover = LivePayloads.requiredNode(hourly, "cloud_cover");
        JsonNode isDay = hourly.path("is_day");
        if (!times.isArray() || !cover.isArray() || times.size() != cover.size()) {
            throw SourceException.malformed("Hourly cloud cover arrays are missing or of different lengths");
        }
        boolean hasDayFlags = isDay.isArray() && isDay.size() == times.size();

        Instant hour = ctx.instant().truncatedTo(ChronoUnit.HOURS);
        Instant nightStart = ctx.localStartOfDay().plusHours(12).toInstant();
        Instant nightEnd = ctx.localStartOfDay().plusHours(36).toInstant();
        Double atInstant = null;
        double nightSum = 0;
        double nightMin = Double.MAX_VALUE;
        int nightHours = 0;
        for (int i = 0; i < times.size(); i++) {
            Instant time = parseHour(times.get(i).asText(""));
            Double percent = LivePayloads.toDouble(cover.get(i), "cloud_cover");
            if (percent == null) {
                continue;
            }
            LivePayloads.inRange(percent, 0.0, 100.0, "cloud_cover");
            if (time.equals(hour)) {
                atInstant = percent;
            }
            boolean dark = hasDayFlags && isDay.get(i).asInt(1) == 0;
            if (dark && !time.isBefore(nightStart) && time.isBefore(nightEnd)) {
                nightSum += percent;
                nightMin = Math.min(nightMin, percent);
                nightHours++;
            }
        }
        if (atInstant == null) {
            throw SourceException.malformed("No cloud cover reported for " + hour);
        }
        return nightHours == 0
                ? new CloudCover(atInstant, null, null)
                : new CloudCover(atInstant, nightSum / nightHours, nightMin);
    }

    @Override
    public CloudCover computeLocal(CalculationContext ctx) {
        throw new UnsupportedOperationException("Cloud cover has no local model");
    }

    private static Instant parseHour(String text) throws SourceException {
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw SourceException.malformed("Invalid hourly time '" + text + "'");
        }
    }
}
