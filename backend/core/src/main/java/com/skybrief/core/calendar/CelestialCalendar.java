package com.skybrief.core.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.skybrief.core.model.EclipseEvent;
import com.skybrief.core.model.MeteorShower;
import com.skybrief.core.util.JsonUtils;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class CelestialCalendar {
    public static final String SHOWERS_RESOURCE = "calendar/meteor-showers.json";
    public static final String ECLIPSES_RESOURCE = "calendar/eclipses.json";

    private final List<MeteorShower> showers;
    private final List<EclipseEvent> eclipses;

    public CelestialCalendar(List<MeteorShower> showers, List<EclipseEvent> eclipses) {
        this.showers = List.copyOf(Objects.requireNonNull(showers, "showers is required"));
        this.eclipses = eclipses.stream()
                .sorted(Comparator.comparing(EclipseEvent::date))
                .toList();
    }

    public static CelestialCalendar standard() {
        return Holder.STANDARD;
    }

    public static CelestialCalendar load(ClassLoader loader, String showersResource, String eclipsesResource) {
        List<MeteorShower> showers = JsonUtils.readResource(loader, showersResource, new TypeReference<>() {
        });
        List<EclipseEvent> eclipses = JsonUtils.readResource(loader, eclipsesResource, new TypeReference<>() {
        });
        return new CelestialCalendar(showers, eclipses);
    }

    public List<MeteorShower> showers() {
        return showers;
    }

    public List<EclipseEvent> eclipses() {
        return eclipses;
    }

    public List<MeteorShower> activeShowers(LocalDate date) {
        return showers.stream().filter(shower -> shower.isActive(date)).toList();
    }

    public List<MeteorShower> showersPeakingWithin(LocalDate from, int days) {
        LocalDate until = from.plusDays(days);
        return showers.stream()
                .filter(shower -> !shower.nextPeak(from).isAfter(until))
                .sorted(Comparator.comparing(shower -> shower.nextPeak(from)))
                .toList();
    }

    public Optional<EclipseEvent> eclipseOn(LocalDate date) {
        return eclipses.stream().filter(eclipse -> eclipse.date().equals(date)).findFirst();
    }

    public List<EclipseEvent> upcomingEclipses(LocalDate from, int horizonDays) {
        return eclipses.stream().filter(eclipse -> eclipse.isUpcoming(from, horizonDays)).toList();
    }

    public Optional<LocalDate> eclipseCoverageEnd() {
        return eclipses.isEmpty() ? Optional.empty() : Optional.of(eclipses.get(eclipses.size() - 1).date());
    }

    private static final class Holder {
        private static final CelestialCalendar STANDARD =
                load(CelestialCalendar.class.getClassLoader(), SHOWERS_RESOURCE, ECLIPSES_RESOURCE);
    }
}
