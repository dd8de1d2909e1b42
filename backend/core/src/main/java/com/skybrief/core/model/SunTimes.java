package com.skybrief.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record SunTimes(
        LocalDate date,
        Instant solarNoon,
        HorizonEvent astronomicalDawn,
        HorizonEvent nauticalDawn,
        HorizonEvent civilDawn,
        HorizonEvent sunrise,
        HorizonEvent sunset,
        HorizonEvent civilDusk,
        HorizonEvent nauticalDusk,
        HorizonEvent astronomicalDusk
) {
    public SunTimes {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(astronomicalDawn, "astronomicalDawn is required");
        Objects.requireNonNull(nauticalDawn, "nauticalDawn is required");
        Objects.requireNonNull(civilDawn, "civilDawn is required");
        Objects.requireNonNull(sunrise, "sunrise is required");
        Objects.requireNonNull(sunset, "sunset is required");
        Objects.requireNonNull(civilDusk, "civilDusk is required");
        Objects.requireNonNull(nauticalDusk, "nauticalDusk is required");
        Objects.requireNonNull(astronomicalDusk, "astronomicalDusk is required");
    }

    public List<HorizonEvent> chronological() {
        return List.of(astronomicalDawn, nauticalDawn, civilDawn, sunrise, sunset, civilDusk, nauticalDusk, astronomicalDusk);
    }

    public boolean isOrdered() {
        Instant previous = null;
        for (HorizonEvent event : chronological()) {
            if (!event.occurs()) {
                continue;
            }
            if (previous != null && event.time().isBefore(previous)) {
                return false;
            }
            previous = event.time();
        }
        return true;
    }

    public Optional<Duration> dayLength() {
        if (sunrise.occurs() && sunset.occurs()) {
            return Optional.of(Duration.between(sunrise.time(), sunset.time()));
        }
        if (sunrise.kind() == HorizonEvent.Kind.ALWAYS_ABOVE) {
            return Optional.of(Duration.ofHours(24));
        }
        if (sunrise.kind() == HorizonEvent.Kind.ALWAYS_BELOW) {
            return Optional.of(Duration.ZERO);
        }
        return Optional.empty();
    }

    // Next morning's dawn is estimated as today's plus one day.
    public Optional<DarkSkyWindow> darkWindow() {
        if (astronomicalDusk.occurs() && astronomicalDawn.occurs()) {
            Instant nextDawn = astronomicalDawn.time().plus(Duration.ofDays(1));
            if (nextDawn.isAfter(astronomicalDusk.time())) {
                return Optional.of(new DarkSkyWindow(astronomicalDusk.time(), nextDawn));
            }
            return Optional.empty();
        }
        if (astronomicalDusk.kind() == HorizonEvent.Kind.ALWAYS_BELOW && solarNoon != null) {
            return Optional.of(new DarkSkyWindow(solarNoon.minus(Duration.ofHours(12)), solarNoon.plus(Duration.ofHours(12))));
        }
        return Optional.empty();
    }
}
