package com.skybrief.service.briefing;

import com.skybrief.core.astro.SolarMath;
import com.skybrief.core.model.CloudCover;
import com.skybrief.core.model.DarkSkyWindow;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.EclipseEvent;
import com.skybrief.core.model.EclipseOutlook;
import com.skybrief.core.model.FactorContribution;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.HorizonEvent;
import com.skybrief.core.model.IssPass;
import com.skybrief.core.model.MeteorOutlook;
import com.skybrief.core.model.MoonState;
import com.skybrief.core.model.PlanetVisibility;
import com.skybrief.core.model.Provenance;
import com.skybrief.core.model.ShowerActivity;
import com.skybrief.core.model.SourceResult;
import com.skybrief.core.model.SpaceWeather;
import com.skybrief.core.model.SunTimes;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.service.runtime.AggregationResult;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the machine-readable form of a briefing: nested maps and lists whose leaves are strings,
 * numbers, booleans or null. Instants are rendered as ISO offset date-times in the display zone.
 */
final class BriefingTree {
    private BriefingTree() {
    }

    static Map<String, Object> daily(DailyBriefing briefing) {
        AggregationResult aggregation = briefing.aggregation();
        ZoneId zone = briefing.displayZone();
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("location", location(aggregation.location()));
        root.put("calculated_for", aggregation.at().withZoneSameInstant(zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        root.put("display_zone", zone.getId());
        root.put("provenance", provenance(aggregation));
        root.put(Domain.MOON.key(), section(aggregation.moon(), moon -> moon(moon, zone)));
        root.put(Domain.SUN.key(), section(aggregation.sun(), sun -> sun(sun, aggregation.location(), aggregation.at().toInstant(), zone)));
        root.put(Domain.PLANETS.key(), section(aggregation.planets(), planets -> planets(planets, zone)));
        root.put(Domain.METEOR_SHOWERS.key(), section(aggregation.meteorShowers(), BriefingTree::meteors));
        root.put(Domain.ECLIPSES.key(), section(aggregation.eclipses(), eclipses -> eclipses(eclipses, zone)));
        root.put(Domain.SPACE_WEATHER.key(), section(aggregation.spaceWeather(), weather -> spaceWeather(weather, zone)));
        root.put(Domain.WEATHER.key(), section(aggregation.weather(), BriefingTree::cloudCover));
        root.put(Domain.ISS_PASSES.key(), section(aggregation.issPasses(), passes -> issPasses(passes, zone)));
        root.put("viewing_score", briefing.viewingScore().map(BriefingTree::score).orElse(null));
        root.put("narrative", briefing.narrative());
        return root;
    }

    static Map<String, Object> tonight(TonightSummary summary) {
        ZoneId zone = summary.displayZone();
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("location", location(summary.location()));
        root.put("calculated_for", summary.at().withZoneSameInstant(zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        root.put("display_zone", zone.getId());
        MoonState moon = summary.moon();
        if (moon == null) {
            root.put("moon", null);
        } else {
            Map<String, Object> moonTree = new LinkedHashMap<>();
            moonTree.put("phase", moon.phase().label());
            moonTree.put("illumination_percent", moon.illuminationPercent());
            moonTree.put("up", moon.isUp());
            moonTree.put("rise", horizon(moon.rise(), zone));
            moonTree.put("set", horizon(moon.set(), zone));
            root.put("moon", moonTree);
        }
        root.put("dark_window", darkWindow(summary.darkWindow(), zone));
        root.put("visible_planets", summary.visiblePlanets().stream().map(p -> p.planet().displayName()).toList());
        root.put("iss_passes", issPasses(summary.issPasses(), zone));
        root.put("active_showers", summary.activeShowers().stream().map(a -> a.shower().name()).toList());
        SpaceWeather space = summary.spaceWeather();
        if (space == null) {
            root.put("aurora", null);
        } else {
            Map<String, Object> aurora = new LinkedHashMap<>();
            aurora.put("kp", round(space.kpIndex(), 2));
            aurora.put("activity", space.activity().label());
            aurora.put("visible", space.auroraVisible());
            root.put("aurora", aurora);
        }
        CloudCover cloud = summary.cloudCover();
        root.put("cloud_cover_percent", cloud == null ? null : round(cloud.percentAtInstant(), 1));
        root.put("viewing_score", summary.score() == null ? null : score(summary.score()));
        root.put("unavailable", summary.unavailable().stream().map(Domain::key).toList());
        root.put("narrative", summary.narrative());
        return root;
    }

    private static Map<String, Object> location(GeoLocation location) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("latitude", location.latitude());
        tree.put("longitude", location.longitude());
        tree.put("elevation_m", location.elevationMeters());
        tree.put("utc_offset", location.offset().map(ZoneId::getId).orElse(null));
        return tree;
    }

    private static Map<String, Object> provenance(AggregationResult aggregation) {
        Map<String, Object> tree = new LinkedHashMap<>();
        aggregation.provenanceSummary().forEach((provenance, domains) ->
                tree.put(provenance.name().toLowerCase(Locale.ROOT), domains.stream().map(Domain::key).toList()));
        return tree;
    }

    private static <T> Map<String, Object> section(SourceResult<T> result, Function<T, Object> valueTree) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("provenance", result.provenance().name().toLowerCase(Locale.ROOT));
        tree.put("reason", result.reason() == FailureReason.NONE
                ? null
                : result.reason().name().toLowerCase(Locale.ROOT));
        tree.put("detail", result.detail());
        tree.put("value", result.provenance() == Provenance.UNAVAILABLE ? null : valueTree.apply(result.value()));
        return tree;
    }

    private static Map<String, Object> moon(MoonState moon, ZoneId zone) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("phase", moon.phase().label());
        tree.put("illumination", round(moon.illumination(), 3));
        tree.put("illumination_percent", moon.illuminationPercent());
        tree.put("age_days", round(moon.ageDays(), 2));
        tree.put("phase_angle", round(moon.phaseAngle(), 1));
        tree.put("altitude_deg", moon.altitudeDegrees() == null ? null : round(moon.altitudeDegrees(), 1));
        tree.put("rise", horizon(moon.rise(), zone));
        tree.put("set", horizon(moon.set(), zone));
        tree.put("next_new_moon", time(moon.nextNewMoon(), zone));
        tree.put("next_full_moon", time(moon.nextFullMoon(), zone));
        return tree;
    }

    private static Map<String, Object> sun(SunTimes sun, GeoLocation location, Instant instant, ZoneId zone) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("date", sun.date().toString());
        tree.put("solar_noon", time(sun.solarNoon(), zone));
        tree.put("astronomical_dawn", horizon(sun.astronomicalDawn(), zone));
        tree.put("nautical_dawn", horizon(sun.nauticalDawn(), zone));
        tree.put("civil_dawn", horizon(sun.civilDawn(), zone));
        tree.put("sunrise", horizon(sun.sunrise(), zone));
        tree.put("sunset", horizon(sun.sunset(), zone));
        tree.put("civil_dusk", horizon(sun.civilDusk(), zone));
        tree.put("nautical_dusk", horizon(sun.nauticalDusk(), zone));
        tree.put("astronomical_dusk", horizon(sun.astronomicalDusk(), zone));
        tree.put("day_length_minutes", sun.dayLength().map(Duration::toMinutes).orElse(null));
        tree.put("dark_window", darkWindow(sun.darkWindow().orElse(null), zone));
        tree.put("twilight_phase", SolarMath.twilightPhase(location.latitude(), location.longitude(), instant).label());
        return tree;
    }

    private static List<Object> planets(List<PlanetVisibility> planets, ZoneId zone) {
        List<Object> list = new ArrayList<>();
        for (PlanetVisibility planet : planets) {
            Map<String, Object> tree = new LinkedHashMap<>();
            tree.put("name", planet.planet().displayName());
            tree.put("visible", planet.visible());
            tree.put("window", planet.window().name().toLowerCase(Locale.ROOT));
            tree.put("window_description", planet.window().label());
            tree.put("magnitude", round(planet.magnitude(), 1));
            tree.put("brightness", planet.brightness());
            tree.put("elongation", round(planet.elongation(), 1));
            tree.put("altitude_deg", planet.altitudeDegrees() == null ? null : round(planet.altitudeDegrees(), 1));
            tree.put("rise", horizon(planet.rise(), zone));
            tree.put("set", horizon(planet.set(), zone));
            tree.put("best_viewing", planet.bestViewing());
            list.add(tree);
        }
        return list;
    }

    private static Map<String, Object> meteors(MeteorOutlook outlook) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("active", outlook.active().stream().map(BriefingTree::shower).toList());
        tree.put("upcoming", outlook.upcoming().stream().map(BriefingTree::shower).toList());
        return tree;
    }

    private static Map<String, Object> shower(ShowerActivity activity) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("name", activity.shower().name());
        tree.put("active", activity.active());
        tree.put("peak_date", activity.peakDate().toString());
        tree.put("days_until_peak", activity.daysUntilPeak());
        tree.put("rating", activity.viewingRating());
        tree.put("zhr", activity.shower().zenithalHourlyRate());
        tree.put("radiant", activity.shower().radiant());
        tree.put("parent_body", activity.shower().parentBody());
        tree.put("speed_km_s", activity.shower().speedKmPerSecond());
        tree.put("window_start", activity.shower().start().toString());
        tree.put("window_end", activity.shower().end().toString());
        return tree;
    }

    private static Map<String, Object> eclipses(EclipseOutlook outlook, ZoneId zone) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("today", outlook.eclipseToday().map(e -> eclipse(e, zone)).orElse(null));
        tree.put("upcoming", outlook.upcoming().stream().map(e -> eclipse(e, zone)).toList());
        tree.put("horizon_days", outlook.horizonDays());
        tree.put("covered_through", outlook.coveredThrough() == null ? null : outlook.coveredThrough().toString());
        return tree;
    }

    private static Map<String, Object> eclipse(EclipseEvent eclipse, ZoneId zone) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", eclipse.kind().label());
        tree.put("date", eclipse.date().toString());
        tree.put("maximum", time(eclipse.maximum(), zone));
        tree.put("duration_minutes", eclipse.durationMinutes());
        tree.put("regions", eclipse.regions());
        tree.put("magnitude", eclipse.magnitude());
        tree.put("notes", eclipse.notes());
        return tree;
    }

    private static Map<String, Object> spaceWeather(SpaceWeather weather, ZoneId zone) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kp", round(weather.kpIndex(), 2));
        tree.put("kp_max_24h", round(weather.kpMax24h(), 2));
        tree.put("activity", weather.activity().label());
        tree.put("activity_description", weather.activity().description());
        tree.put("solar_wind_speed_km_s", weather.solarWindSpeedKmPerSecond());
        tree.put("solar_wind_density", weather.solarWindDensity());
        tree.put("aurora_visibility_latitude", round(weather.auroraVisibilityLatitude(), 1));
        tree.put("aurora_visible", weather.auroraVisible());
        tree.put("observed_at", time(weather.observedAt(), zone));
        return tree;
    }

    private static List<Object> issPasses(List<IssPass> passes, ZoneId zone) {
        List<Object> list = new ArrayList<>();
        for (IssPass pass : passes) {
            Map<String, Object> tree = new LinkedHashMap<>();
            tree.put("start", time(pass.start(), zone));
            tree.put("peak", time(pass.peak(), zone));
            tree.put("end", time(pass.end(), zone));
            tree.put("duration_seconds", pass.duration().toSeconds());
            tree.put("max_elevation_deg", round(pass.maxElevation(), 1));
            tree.put("start_direction", pass.startDirection());
            tree.put("end_direction", pass.endDirection());
            tree.put("magnitude", pass.magnitude());
            list.add(tree);
        }
        return list;
    }

    private static Map<String, Object> cloudCover(CloudCover cloud) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("percent", round(cloud.percentAtInstant(), 1));
        tree.put("description", cloud.description());
        tree.put("night_average_percent", cloud.nightAveragePercent() == null ? null : round(cloud.nightAveragePercent(), 1));
        tree.put("night_minimum_percent", cloud.nightMinimumPercent() == null ? null : round(cloud.nightMinimumPercent(), 1));
        return tree;
    }

    private static Map<String, Object> score(ViewingConditionsScore score) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("value", score.value());
        tree.put("category", score.category().label());
        tree.put("darkness", score.darkness() == null ? null : score.darkness().label());
        tree.put("darkness_multiplier", score.darknessMultiplier());
        List<Object> breakdown = new ArrayList<>();
        for (FactorContribution factor : score.breakdown()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("factor", factor.factor().key());
            entry.put("sub_score", round(factor.subScore(), 1));
            entry.put("weight", factor.weight());
            entry.put("normalized_weight", round(factor.normalizedWeight(), 4));
            entry.put("contribution", round(factor.contribution(), 2));
            breakdown.add(entry);
        }
        tree.put("breakdown", breakdown);
        tree.put("recommendations", score.recommendations());
        return tree;
    }

    private static Map<String, Object> darkWindow(DarkSkyWindow window, ZoneId zone) {
        if (window == null) {
            return null;
        }
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("start", time(window.start(), zone));
        tree.put("end", time(window.end(), zone));
        tree.put("best_viewing", time(window.bestViewingTime(), zone));
        tree.put("hours", round(window.duration().toMinutes() / 60.0, 2));
        return tree;
    }

    static Map<String, Object> horizon(HorizonEvent event, ZoneId zone) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("status", event.kind().name().toLowerCase(Locale.ROOT));
        tree.put("time", time(event.time(), zone));
        return tree;
    }

    private static String time(Instant instant, ZoneId zone) {
        return instant == null ? null : instant.atZone(zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
