package com.skybrief.service.briefing;

import com.skybrief.core.model.EclipseEvent;
import com.skybrief.core.model.EclipseOutlook;
import com.skybrief.core.model.IssPass;
import com.skybrief.core.model.MeteorOutlook;
import com.skybrief.core.model.PlanetVisibility;
import com.skybrief.core.model.ShowerActivity;
import com.skybrief.core.model.SunTimes;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.service.runtime.AggregationResult;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Stateless: the same aggregation and score always give the same briefing.
 */
public class BriefingSynthesizer {

    public DailyBriefing synthesize(AggregationResult aggregation, ViewingConditionsScore score) {
        ZoneId zone = displayZone(aggregation);
        EclipseEvent eclipseToday = aggregation.eclipses().optionalValue()
                .flatMap(EclipseOutlook::eclipseToday)
                .orElse(null);
        LocalDate date = aggregation.at().withZoneSameInstant(zone).toLocalDate();
        String narrative = new NarrativeWriter(zone).daily(
                date,
                aggregation.sun().value(),
                aggregation.moon().value(),
                eclipseToday,
                issPasses(aggregation, date.atStartOfDay(zone), 0, 24),
                planetNames(visiblePlanets(aggregation)),
                activeShowers(aggregation),
                aggregation.spaceWeather().value(),
                score,
                aggregation.weather().value(),
                aggregation.unavailableDomains()
        );
        return new DailyBriefing(aggregation, score, narrative);
    }

    public TonightSummary tonight(AggregationResult aggregation, ViewingConditionsScore score) {
        ZoneId zone = displayZone(aggregation);
        List<PlanetVisibility> planets = visiblePlanets(aggregation);
        ZonedDateTime startOfDay = aggregation.at().withZoneSameInstant(zone).toLocalDate().atStartOfDay(zone);
        List<IssPass> passes = issPasses(aggregation, startOfDay, 12, 36);
        List<ShowerActivity> showers = activeShowers(aggregation);
        SunTimes sun = aggregation.sun().value();
        String narrative = new NarrativeWriter(zone).tonight(
                aggregation.moon().value(),
                sun == null ? null : sun.darkWindow().orElse(null),
                passes,
                planets,
                showers,
                aggregation.spaceWeather().value(),
                score,
                aggregation.weather().value(),
                aggregation.unavailableDomains()
        );
        return new TonightSummary(
                aggregation.location(),
                aggregation.at(),
                zone,
                aggregation.moon().value(),
                sun == null ? null : sun.darkWindow().orElse(null),
                planets,
                passes,
                showers,
                aggregation.spaceWeather().value(),
                aggregation.weather().value(),
                score,
                aggregation.unavailableDomains(),
                narrative
        );
    }

    private static ZoneId displayZone(AggregationResult aggregation) {
        return aggregation.location().localOffset();
    }

    private static List<PlanetVisibility> visiblePlanets(AggregationResult aggregation) {
        return aggregation.planets().optionalValue()
                .map(planets -> planets.stream().filter(PlanetVisibility::visible).toList())
                .orElse(List.of());
    }

    // Passes starting between the given hours after local midnight.
    private static List<IssPass> issPasses(AggregationResult aggregation, ZonedDateTime startOfDay, int fromHour, int untilHour) {
        Instant from = startOfDay.plusHours(fromHour).toInstant();
        Instant until = startOfDay.plusHours(untilHour).toInstant();
        return aggregation.issPasses().optionalValue()
                .map(passes -> passes.stream().filter(pass -> pass.startsWithin(from, until)).toList())
                .orElse(List.of());
    }

    private static List<String> planetNames(List<PlanetVisibility> planets) {
        return planets.stream().map(p -> p.planet().displayName()).toList();
    }

    private static List<ShowerActivity> activeShowers(AggregationResult aggregation) {
        return aggregation.meteorShowers().optionalValue()
                .map(MeteorOutlook::active)
                .orElse(List.of());
    }
}
