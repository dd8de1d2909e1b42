package com.skybrief.calculators.iss;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.IssPass;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Visible ISS passes from the N2YO visual-passes service. Pass prediction needs fresh orbital
 * elements, so there is no local model: without an API key the domain has no live source at all.
 */
public class IssPassCalculator implements Calculator<List<IssPass>> {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.n2yo.com/rest/v1/satellite/visualpasses");
    static final int ISS_NORAD_ID = 25544;
    static final int FORECAST_DAYS = 2;
    static final int MIN_VISIBLE_SECONDS = 60;

    private final URI endpoint;
    private final String apiKey;

    public IssPassCalculator(String apiKey) {
        this(DEFAULT_ENDPOINT, apiKey);
    }

    public IssPassCalculator(URI endpoint, String apiKey) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
    }

    @Override
    public Domain domain() {
        return Domain.ISS_PASSES;
    }

    @Override
    public boolean hasLiveSource() {
        return apiKey != null;
    }

    @Override
    public boolean hasLocalFallback() {
        return false;
    }

    // Keeps passes that start between local midnight and the following local noon, which covers
    // the calendar day and the night after it.
    @Override
    public List<IssPass> computeLive(CalculationContext ctx) throws SourceException {
        if (apiKey == null) {
            throw new SourceException(FailureReason.DISABLED, "No N2YO API key configured");
        }
        URI uri = LivePayloads.withQuery(path(ctx), "apiKey", apiKey);
        JsonNode root = LivePayloads.fetchTree(ctx, uri);
        if (root.hasNonNull("error")) {
            throw new SourceException(FailureReason.HTTP_STATUS, "N2YO rejected the request: " + root.path("error").asText());
        }
        JsonNode passes = root.path("passes");
        if (passes.isMissingNode() || passes.isNull()) {
            return List.of();
        }
        if (!passes.isArray()) {
            throw SourceException.malformed("ISS passes are not an array");
        }

        Instant from = ctx.localStartOfDay().toInstant();
        Instant until = ctx.localStartOfDay().plusHours(36).toInstant();
        List<IssPass> parsed = new ArrayList<>();
        for (JsonNode pass : passes) {
            parsed.add(pass(pass));
        }
        List<IssPass> inWindow = parsed.stream()
                .filter(pass -> pass.startsWithin(from, until))
                .sorted(Comparator.comparing(IssPass::start))
                .toList();
        if (!parsed.isEmpty() && !covers(parsed, from)) {
            throw new SourceException(FailureReason.STALE_DATA,
                    "Predicted passes from " + parsed.get(0).start() + " do not cover " + ctx.localDate());
        }
        return inWindow;
    }

    // Predictions run forward from the provider's clock, so a day far from it sees only passes
    // that all ended before it or all start after the forecast span.
    private static boolean covers(List<IssPass> passes, Instant dayStart) {
        Instant latestUsefulStart = dayStart.plus(Duration.ofDays(FORECAST_DAYS + 1L));
        boolean allBefore = passes.stream().allMatch(pass -> pass.end().isBefore(dayStart));
        boolean allAfter = passes.stream().allMatch(pass -> !pass.start().isBefore(latestUsefulStart));
        return !allBefore && !allAfter;
    }

    @Override
    public List<IssPass> computeLocal(CalculationContext ctx) {
        throw new UnsupportedOperationException("ISS passes have no local model");
    }

    private URI path(CalculationContext ctx) {
        long altitude = Math.round(ctx.location().elevationMeters() == null ? 0.0 : ctx.location().elevationMeters());
        String base = endpoint.toString();
        return URI.create(base + (base.endsWith("/") ? "" : "/") + ISS_NORAD_ID
                + "/" + ctx.latitude() + "/" + ctx.longitude() + "/" + altitude
                + "/" + FORECAST_DAYS + "/" + MIN_VISIBLE_SECONDS + "/");
    }

    private static IssPass pass(JsonNode pass) throws SourceException {
        Instant start = epoch(pass, "startUTC");
        Instant peak = epoch(pass, "maxUTC");
        Instant end = epoch(pass, "endUTC");
        if (end.isBefore(start) || peak.isBefore(start) || peak.isAfter(end)) {
            throw SourceException.malformed("ISS pass times out of order starting " + start);
        }
        double maxElevation = LivePayloads.inRange(LivePayloads.requiredDouble(pass, "maxEl"), 0.0, 90.0, "maxEl");
        return new IssPass(
                start,
                peak,
                end,
                maxElevation,
                pass.path("startAzCompass").asText(null),
                pass.path("endAzCompass").asText(null),
                LivePayloads.optionalDouble(pass, "mag")
        );
    }

    private static Instant epoch(JsonNode pass, String field) throws SourceException {
        return Instant.ofEpochSecond((long) LivePayloads.requiredDouble(pass, field));
    }
}
