package com.skybrief.calculators.moon;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.astro.LunarMath;
import com.skybrief.core.astro.RiseSet;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.HorizonEvent;
import com.skybrief.core.model.MoonPhase;
import com.skybrief.core.model.MoonState;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

public class MoonCalculator implements Calculator<MoonState> {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://aa.usno.navy.mil/api/rstt/oneday");

    private final URI endpoint;

    public MoonCalculator() {
        this(DEFAULT_ENDPOINT);
    }

    public MoonCalculator(URI endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
    }

    @Override
    public Domain domain() {
        return Domain.MOON;
    }

    @Override
    public boolean hasLiveSource() {
        return true;
    }

    @Override
    public boolean hasLocalFallback() {
        return true;
    }

    // Phase and illumination come from the provider; altitude, age and upcoming phases are computed here.
    @Override
    public MoonState computeLive(CalculationContext ctx) throws SourceException {
        LocalDate date = ctx.localDate();
        ZoneOffset offset = ctx.localOffset();
        URI uri = LivePayloads.withQuery(endpoint,
                "date", date.toString(),
                "coords", ctx.latitude() + "," + ctx.longitude(),
                "tz", formatHours(offset));
        JsonNode data = LivePayloads.requiredNode(LivePayloads.requiredNode(LivePayloads.fetchTree(ctx, uri), "properties"), "data");

        String phaseText = LivePayloads.requiredText(data, "curphase");
        MoonPhase phase = MoonPhase.fromLabel(phaseText)
                .orElseThrow(() -> SourceException.malformed("Unknown moon phase '" + phaseText + "'"));
        double illumination = parsePercent(LivePayloads.requiredText(data, "fracillum")) / 100.0;

        HorizonEvent rise = HorizonEvent.notInWindow();
        HorizonEvent set = HorizonEvent.notInWindow();
        for (JsonNode entry : data.path("moondata")) {
            String phen = entry.path("phen").asText("");
            if (phen.equalsIgnoreCase("Rise")) {
                rise = HorizonEvent.occurs(localTime(entry, date, offset));
            } else if (phen.equalsIgnoreCase("Set")) {
                set = HorizonEvent.occurs(localTime(entry, date, offset));
            }
        }
        return state(ctx, phase, illumination, rise, set);
    }

    @Override
    public MoonState computeLocal(CalculationContext ctx) {
        Instant instant = ctx.instant();
        double angle = LunarMath.phaseAngle(instant);
        Instant dayStart = ctx.localStartOfDay().toInstant();
        RiseSet riseSet = LunarMath.riseAndSet(ctx.latitude(), ctx.longitude(), dayStart, ctx.localStartOfDay().plusDays(1).toInstant());
        return state(ctx, LunarMath.phaseFor(angle), LunarMath.illumination(angle), riseSet.rise(), riseSet.set());
    }

    private MoonState state(CalculationContext ctx, MoonPhase phase, double illumination, HorizonEvent rise, HorizonEvent set) {
        Instant instant = ctx.instant();
        return new MoonState(
                phase,
                illumination,
                LunarMath.ageDays(instant),
                LunarMath.phaseAngle(instant),
                LunarMath.altitude(ctx.latitude(), ctx.longitude(), instant),
                rise,
                set,
                LunarMath.nextNewMoon(instant),
                LunarMath.nextFullMoon(instant)
        );
    }

    static String formatHours(ZoneOffset offset) {
        int seconds = offset.getTotalSeconds();
        if (seconds % 3600 == 0) {
            return Integer.toString(seconds / 3600);
        }
        return String.format(Locale.ROOT, "%.2f", seconds / 3600.0);
    }

    private static double parsePercent(String text) throws SourceException {
        String digits = text.trim().replace("%", "").trim();
        try {
            return LivePayloads.inRange(Double.parseDouble(digits), 0.0, 100.0, "fracillum");
        } catch (NumberFormatException e) {
            throw SourceException.malformed("Non-numeric illumination '" + text + "'");
        }
    }

    private static Instant localTime(JsonNode entry, LocalDate date, ZoneOffset offset) throws SourceException {
        String text = LivePayloads.requiredText(entry, "time");
        try {
            return LocalTime.parse(text).atDate(date).toInstant(offset);
        } catch (DateTimeParseException e) {
            throw SourceException.malformed("Invalid moon event time '" + text + "'");
        }
    }
}
