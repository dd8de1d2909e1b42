package com.skybrief.core.astro;

import com.skybrief.core.model.MoonPhase;

import java.time.Duration;
import java.time.Instant;

public final class LunarMath {
    public static final double SYNODIC_MONTH_DAYS = 29.53058867;
    public static final Instant REFERENCE_NEW_MOON = Instant.parse("2000-01-06T18:14:00Z");
    // Geocentric altitude of the upper limb at rise, allowing for parallax and refraction.
    public static final double RISE_ALTITUDE = 0.125;

    private static final double OBLIQUITY_J2000 = 23.4397;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final Duration SCAN_STEP = Duration.ofMinutes(10);

    private LunarMath() {
    }

    public static double ageDays(Instant instant) {
        double days = Duration.between(REFERENCE_NEW_MOON, instant).toMillis() / MILLIS_PER_DAY;
        double age = days - SYNODIC_MONTH_DAYS * Math.floor(days / SYNODIC_MONTH_DAYS);
        return age >= SYNODIC_MONTH_DAYS ? 0.0 : age;
    }

    public static double phaseAngle(Instant instant) {
        return AngleMath.normalize(ageDays(instant) / SYNODIC_MONTH_DAYS * 360.0);
    }

    public static double illumination(double phaseAngle) {
        return AngleMath.clamp((1.0 - AngleMath.cos(phaseAngle)) / 2.0, 0.0, 1.0);
    }

    public static MoonPhase phaseFor(double phaseAngle) {
        return MoonPhase.fromBucket((int) Math.floor(AngleMath.normalize(phaseAngle + 22.5) / 45.0));
    }

    public static Instant nextNewMoon(Instant instant) {
        double remaining = SYNODIC_MONTH_DAYS - ageDays(instant);
        return instant.plusMillis(Math.round(remaining * MILLIS_PER_DAY));
    }

    public static Instant nextFullMoon(Instant instant) {
        double age = ageDays(instant);
        double half = SYNODIC_MONTH_DAYS / 2.0;
        double remaining = age < half ? half - age : SYNODIC_MONTH_DAYS + half - age;
        return instant.plusMillis(Math.round(remaining * MILLIS_PER_DAY));
    }

    // Low-precision series (Astronomical Almanac), about a degree in position.
    public static EquatorialPosition position(double julianDay) {
        double d = julianDay - JulianDate.J2000;
        double meanLongitude = 218.316 + 13.176396 * d;
        double meanAnomaly = 134.963 + 13.064993 * d;
        double argumentOfLatitude = 93.272 + 13.229350 * d;
        double longitude = meanLongitude + 6.289 * AngleMath.sin(meanAnomaly);
        double latitude = 5.128 * AngleMath.sin(argumentOfLatitude);
        double distanceKm = 385_001 - 20_905 * AngleMath.cos(meanAnomaly);
        return EquatorialPosition.fromEcliptic(longitude, latitude, distanceKm, OBLIQUITY_J2000);
    }

    public static double altitude(double latitude, double longitude, Instant instant) {
        double jd = JulianDate.of(instant);
        return position(jd).altitudeDegrees(latitude, longitude, jd);
    }

    public static RiseSet riseAndSet(double latitude, double longitude, Instant windowStart, Instant windowEnd) {
        return CrossingSearch.scan(t -> altitude(latitude, longitude, t), windowStart, windowEnd, SCAN_STEP, RISE_ALTITUDE);
    }
}
