package com.skybrief.service.briefing;

import com.skybrief.core.model.CloudCover;
import com.skybrief.core.model.DarkSkyWindow;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.EclipseEvent;
import com.skybrief.core.model.GeomagActivity;
import com.skybrief.core.model.HorizonEvent;
import com.skybrief.core.model.IssPass;
import com.skybrief.core.model.MoonState;
import com.skybrief.core.model.PlanetVisibility;
import com.skybrief.core.model.ShowerActivity;
import com.skybrief.core.model.SpaceWeather;
import com.skybrief.core.model.SunTimes;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.core.model.ViewingWindow;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Template sentences for screen-reader playback. A domain with nothing to report contributes no
 * sentence; unavailable domains are named in a closing caveat instead of being guessed at.
 */
final class NarrativeWriter {
    static final String NO_DATA = "Sky data is currently unavailable. Please check back later.";

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final int MAX_LISTED_PASSES = 4;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);

    private final ZoneId zone;

    NarrativeWriter(ZoneId zone) {
        this.zone = zone;
    }

    String daily(
            LocalDate date,
            SunTimes sun,
            MoonState moon,
            EclipseEvent eclipseToday,
            List<IssPass> issPasses,
            List<String> visiblePlanets,
            List<ShowerActivity> activeShowers,
            SpaceWeather spaceWeather,
            ViewingConditionsScore score,
            CloudCover cloud,
            List<Domain> unavailable
    ) {
        List<String> content = new ArrayList<>();
        if (sun != null) {
            addIfPresent(content, sunSentence(sun));
        }
        if (moon != null) {
            content.add(dailyMoonSentence(moon));
        }
        if (eclipseToday != null) {
            content.add(eclipseSentence(eclipseToday));
        }
        addIfPresent(content, dailyIssSentence(issPasses));
        addIfPresent(content, dailyPlanetSentence(visiblePlanets));
        addIfPresent(content, dailyShowerSentence(activeShowers));
        if (spaceWeather != null) {
            content.addAll(dailySpaceWeatherSentences(spaceWeather));
        }
        if (score != null) {
            content.add(viewingSentence(score, cloud));
        }
        if (content.isEmpty()) {
            return "Sky briefing for " + DAY.format(date) + ". " + NO_DATA;
        }
        List<String> sentences = new ArrayList<>();
        sentences.add("Sky briefing for " + DAY.format(date) + ".");
        sentences.addAll(content);
        addIfPresent(sentences, caveat(unavailable));
        return String.join(" ", sentences);
    }

    String tonight(
            MoonState moon,
            DarkSkyWindow darkWindow,
            List<IssPass> issPasses,
            List<PlanetVisibility> visiblePlanets,
            List<ShowerActivity> activeShowers,
            SpaceWeather spaceWeather,
            ViewingConditionsScore score,
            CloudCover cloud,
            List<Domain> unavailable
    ) {
        List<String> content = new ArrayList<>();
        if (moon != null) {
            content.add(tonightMoonSentence(moon));
        }
        if (darkWindow != null) {
            content.add("Full darkness runs from " + clock(darkWindow.start()) + " to " + clock(darkWindow.end())
                    + ", best around " + clock(darkWindow.bestViewingTime()) + ".");
        }
        addIfPresent(content, tonightIssSentence(issPasses));
        addIfPresent(content, tonightPlanetSentence(visiblePlanets));
        addIfPresent(content, tonightShowerSentence(activeShowers));
        if (spaceWeather != null) {
            addIfPresent(content, tonightAuroraSentence(spaceWeather));
        }
        if (score != null) {
            content.add(viewingSentence(score, cloud));
        }
        if (content.isEmpty()) {
            return "Tonight: " + NO_DATA;
        }
        List<String> sentences = new ArrayList<>();
        sentences.add("Tonight:");
        sentences.addAll(content);
        addIfPresent(sentences, caveat(unavailable));
        return String.join(" ", sentences);
    }

    String sunSentence(SunTimes sun) {
        HorizonEvent sunrise = sun.sunrise();
        HorizonEvent sunset = sun.sunset();
        if (sunrise.occurs() && sunset.occurs()) {
            String sentence = "Sunrise at " + clock(sunrise.time()) + ", sunset at " + clock(sunset.time());
            Duration length = sun.dayLength().orElse(null);
            if (length != null && !length.isNegative()) {
                sentence += " (" + hoursAndMinutes(length) + " of daylight)";
            }
            return sentence + ".";
        }
        if (sunrise.occurs()) {
            return "Sunrise at " + clock(sunrise.time()) + ".";
        }
        if (sunset.occurs()) {
            return "Sunset at " + clock(sunset.time()) + ".";
        }
        if (sunrise.kind() == HorizonEvent.Kind.ALWAYS_ABOVE) {
            return "The sun stays above the horizon all day.";
        }
        if (sunrise.kind() == HorizonEvent.Kind.ALWAYS_BELOW) {
            return "The sun does not rise today.";
        }
        return null;
    }

    private String dailyMoonSentence(MoonState moon) {
        StringBuilder sentence = new StringBuilder("Moon: ")
                .append(moon.phase().label())
                .append(" (").append(moon.illuminationPercent()).append("% illuminated)");
        List<String> times = new ArrayList<>();
        if (moon.rise().occurs()) {
            times.add("rises " + clock(moon.rise().time()));
        }
        if (moon.set().occurs()) {
            times.add("sets " + clock(moon.set().time()));
        }
        if (!times.isEmpty()) {
            sentence.append(", ").append(String.join(" and ", times));
        } else if (moon.rise().kind() == HorizonEvent.Kind.ALWAYS_ABOVE) {
            sentence.append(", above the horizon all day");
        } else if (moon.rise().kind() == HorizonEvent.Kind.ALWAYS_BELOW) {
            sentence.append(", below the horizon all day");
        }
        return sentence.append('.').toString();
    }

    private String tonightMoonSentence(MoonState moon) {
        StringBuilder sentence = new StringBuilder(moon.phase().label())
                .append(" (").append(moon.illuminationPercent()).append("% illuminated)");
        if (moon.rise().occurs()) {
            sentence.append(" rises at ").append(clock(moon.rise().time()));
        } else if (moon.set().occurs()) {
            sentence.append(" sets at ").append(clock(moon.set().time()));
        }
        return sentence.append('.').toString();
    }

    private static String eclipseSentence(EclipseEvent eclipse) {
        String sentence = "Eclipse today: " + eclipse.kind().label();
        if (!eclipse.regions().isEmpty()) {
            sentence += ", visible from " + String.join(", ", eclipse.regions().subList(0, Math.min(3, eclipse.regions().size())));
        }
        return sentence + ".";
    }

    String dailyIssSentence(List<IssPass> passes) {
        if (passes.isEmpty()) {
            return null;
        }
        if (passes.size() == 1) {
            return "The ISS passes over at " + passTime(passes.get(0)) + ".";
        }
        List<String> times = passes.stream().limit(MAX_LISTED_PASSES).map(this::passTime).toList();
        return "The ISS has " + passes.size() + " visible passes today: " + andList(times) + ".";
    }

    String tonightIssSentence(List<IssPass> passes) {
        if (passes.isEmpty()) {
            return null;
        }
        if (passes.size() == 1) {
            return "The ISS passes over at " + passTime(passes.get(0)) + ".";
        }
        return "The ISS has " + passes.size() + " visible passes tonight.";
    }

    static String dailyPlanetSentence(List<String> planets) {
        if (planets.isEmpty()) {
            return null;
        }
        if (planets.size() == 1) {
            return planets.get(0) + " is visible today.";
        }
        if (planets.size() == 2) {
            return planets.get(0) + " and " + planets.get(1) + " are visible.";
        }
        return "Visible planets: " + serialList(planets) + ".";
    }

    static String tonightPlanetSentence(List<PlanetVisibility> planets) {
        if (planets.isEmpty()) {
            return null;
        }
        List<String> names = planets.stream().map(p -> p.planet().displayName()).toList();
        if (names.size() == 1) {
            return names.get(0) + " is visible in the sky.";
        }
        if (names.size() == 2) {
            return names.get(0) + " and " + names.get(1) + " are visible " + sharedSky(planets) + ".";
        }
        return serialList(names) + " are visible tonight.";
    }

    private static String sharedSky(List<PlanetVisibility> planets) {
        ViewingWindow window = planets.get(0).window();
        if (planets.stream().anyMatch(p -> p.window() != window)) {
            return "tonight";
        }
        if (window == ViewingWindow.EVENING) {
            return "in the evening sky";
        }
        if (window == ViewingWindow.MORNING) {
            return "in the morning sky";
        }
        return "tonight";
    }

    static String dailyShowerSentence(List<ShowerActivity> showers) {
        if (showers.isEmpty()) {
            return null;
        }
        if (showers.size() == 1) {
            ShowerActivity only = showers.get(0);
            return only.peaksTonight()
                    ? "The " + only.shower().name() + " meteor shower is active and peaks tonight."
                    : "The " + only.shower().name() + " meteor shower is active.";
        }
        return "Active meteor showers: " + firstTwoShowers(showers) + ".";
    }

    static String tonightShowerSentence(List<ShowerActivity> showers) {
        if (showers.isEmpty()) {
            return null;
        }
        if (showers.size() == 1) {
            return "The " + showers.get(0).shower().name() + " meteor shower is active.";
        }
        return "The " + firstTwoShowers(showers) + " meteor showers are active.";
    }

    // Quiet conditions are left out.
    static List<String> dailySpaceWeatherSentences(SpaceWeather weather) {
        double kp = weather.kpIndex();
        if (kp >= 5) {
            List<String> sentences = new ArrayList<>();
            sentences.add("Space weather: " + GeomagActivity.fromKp(kp).label() + " (Kp " + wholeKp(kp) + ").");
            sentences.add(weather.auroraVisible()
                    ? "Aurora may be visible from this location."
                    : "Aurora may be visible poleward of " + Math.round(weather.auroraVisibilityLatitude()) + " degrees latitude.");
            return sentences;
        }
        if (kp >= 4) {
            return List.of("Space weather is active (Kp " + wholeKp(kp) + ") - aurora possible at high latitudes.");
        }
        return List.of();
    }

    static String tonightAuroraSentence(SpaceWeather weather) {
        double kp = weather.kpIndex();
        if (kp >= 4) {
            return "Aurora activity is " + GeomagActivity.fromKp(kp).label().toLowerCase(Locale.ROOT) + " (Kp " + wholeKp(kp) + ").";
        }
        if (kp >= 3) {
            return "Aurora may be visible at high latitudes.";
        }
        return null;
    }

    static String viewingSentence(ViewingConditionsScore score, CloudCover cloud) {
        String sentence = "Viewing conditions are " + score.category().label().toLowerCase(Locale.ROOT)
                + " (" + score.value() + "/100)";
        if (cloud != null && cloud.percentAtInstant() >= 75) {
            sentence += " with overcast skies";
        } else if (cloud != null && cloud.percentAtInstant() >= 50) {
            sentence += " with partly cloudy skies";
        } else if (cloud != null) {
            sentence += " - " + cloud.description().toLowerCase(Locale.ROOT);
        }
        return sentence + ".";
    }

    static String caveat(List<Domain> unavailable) {
        if (unavailable.isEmpty()) {
            return null;
        }
        List<String> labels = unavailable.stream().map(d -> midSentence(d.label())).toList();
        return "Data is currently unavailable for " + andList(labels) + ".";
    }

    private String passTime(IssPass pass) {
        long minutes = Math.max(1, Math.round(pass.duration().toSeconds() / 60.0));
        return clock(pass.start()) + " for " + minutes + (minutes == 1 ? " minute" : " minutes");
    }

    private String clock(Instant instant) {
        return CLOCK.format(instant.atZone(zone));
    }

    // Labels opening with an acronym keep their case.
    private static String midSentence(String label) {
        String first = label.split(" ", 2)[0];
        return first.equals(first.toUpperCase(Locale.ROOT)) ? label : label.toLowerCase(Locale.ROOT);
    }

    private static String hoursAndMinutes(Duration duration) {
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + (hours == 1 ? " hour " : " hours ") + minutes + (minutes == 1 ? " minute" : " minutes");
    }

    private static String wholeKp(double kp) {
        return String.valueOf(Math.round(kp));
    }

    private static String firstTwoShowers(List<ShowerActivity> showers) {
        return showers.get(0).shower().name() + " and " + showers.get(1).shower().name();
    }

    private static String serialList(List<String> items) {
        return String.join(", ", items.subList(0, items.size() - 1)) + ", and " + items.get(items.size() - 1);
    }

    private static String andList(List<String> items) {
        if (items.size() == 1) {
            return items.get(0);
        }
        if (items.size() == 2) {
            return items.get(0) + " and " + items.get(1);
        }
        return serialList(items);
    }

    private static void addIfPresent(List<String> sentences, String sentence) {
        if (sentence != null) {
            sentences.add(sentence);
        }
    }
}
