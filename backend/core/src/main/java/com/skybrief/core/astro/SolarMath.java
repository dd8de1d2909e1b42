package com.skybrief.core.astro;

import com.skybrief.core.model.HorizonEvent;
import com.skybrief.core.model.SunTimes;
import com.skybrief.core.model.TwilightPhase;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.function.ToDoubleFunction;

/**
 * Low-order solar series from the NOAA solar calculator, good to well under a minute for
 * rise, set and twilight times outside the polar circles.
 */
public final class SolarMath {
    public static final double SUNRISE_ALTITUDE = 0.0;
    public static final double CIVIL_ALTITUDE = -6.0;
    public static final double NAUTICAL_ALTITUDE = -12.0;
    public static final double ASTRONOMICAL_ALTITUDE = -18.0;

    private static final double SIDEREAL_DEGREES_PER_DAY = 360.98564736629;
    private static final Duration HALF_DAY = Duration.ofHours(12);
    private static final int TRANSIT_CORRECTIONS = 3;

    private SolarMath() {
    }

    public static EquatorialPosition position(double julianDay) {
        double t = JulianDate.centuriesSinceJ2000(julianDay);
        double meanLongitude = AngleMath.normalize(280.46646 + t * (36000.76983 + t * 0.0003032));
        double meanAnomaly = 357.52911 + t * (35999.05029 - 0.0001537 * t);
        double eccentricity = 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
        double center = AngleMath.sin(meanAnomaly) * (1.914602 - t * (0.004817 + 0.000014 * t))
                + AngleMath.sin(2 * meanAnomaly) * (0.019993 - 0.000101 * t)
                + AngleMath.sin(3 * meanAnomaly) * 0.000289;
        double trueLongitude = meanLongitude + center;
        double trueAnomaly = meanAnomaly + center;
        double distance = 1.000001018 * (1 - eccentricity * eccentricity)
                / (1 + eccentricity * AngleMath.cos(trueAnomaly));
        double omega = 125.04 - 1934.136 * t;
        double apparentLongitude = trueLongitude - 0.00569 - 0.00478 * AngleMath.sin(omega);
        double obliquity = meanObliquity(t) + 0.00256 * AngleMath.cos(omega);
        return EquatorialPosition.fromEcliptic(apparentLongitude, 0.0, distance, obliquity);
    }

    public static double altitude(double latitude, double longitude, Instant instant) {
        double jd = JulianDate.of(instant);
        return position(jd).altitudeDegrees(latitude, longitude, jd);
    }

    public static TwilightPhase twilightPhase(double latitude, double longitude, Instant instant) {
        return TwilightPhase.fromSolarAltitude(altitude(latitude, longitude, instant));
    }

    public static Instant solarTransit(LocalDate date, double longitude) {
        Instant transit = date.atTime(12, 0).toInstant(ZoneOffset.UTC)
                .minusMillis(Math.round(longitude / 15.0 * 3_600_000));
        for (int i = 0; i < TRANSIT_CORRECTIONS; i++) {
            double jd = JulianDate.of(transit);
            double hourAngle = AngleMath.normalizeSigned(
                    JulianDate.greenwichSiderealDegrees(jd) + longitude - position(jd).rightAscension());
            transit = transit.minusMillis(Math.round(hourAngle / SIDEREAL_DEGREES_PER_DAY * 86_400_000));
        }
        return transit;
    }

    public static HorizonEvent dawn(LocalDate date, double latitude, double longitude, double threshold) {
        Instant transit = solarTransit(date, longitude);
        return CrossingSearch.bisect(t -> altitude(latitude, longitude, t), transit.minus(HALF_DAY), transit, threshold);
    }

    public static HorizonEvent dusk(LocalDate date, double latitude, double longitude, double threshold) {
        Instant transit = solarTransit(date, longitude);
        return CrossingSearch.bisect(t -> altitude(latitude, longitude, t), transit, transit.plus(HALF_DAY), threshold);
    }

    public static SunTimes sunTimes(LocalDate date, double latitude, double longitude) {
        Instant transit = solarTransit(date, longitude);
        Instant morning = transit.minus(HALF_DAY);
        Instant evening = transit.plus(HALF_DAY);
        ToDoubleFunction<Instant> sunAltitude = t -> altitude(latitude, longitude, t);
        return new SunTimes(
                date,
                transit,
                CrossingSearch.bisect(sunAltitude, morning, transit, ASTRONOMICAL_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, morning, transit, NAUTICAL_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, morning, transit, CIVIL_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, morning, transit, SUNRISE_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, transit, evening, SUNRISE_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, transit, evening, CIVIL_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, transit, evening, NAUTICAL_ALTITUDE),
                CrossingSearch.bisect(sunAltitude, transit, evening, ASTRONOMICAL_ALTITUDE)
        );
    }

    static double meanObliquity(double centuries) {
        double seconds = 21.448 - centuries * (46.815 + centuries * (0.00059 - centuries * 0.001813));
        return 23.0 + (26.0 + seconds / 60.0) / 60.0;
    }
}
