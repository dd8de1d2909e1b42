package com.skybrief.core.astro;

import java.time.Instant;

public final class JulianDate {
    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private JulianDate() {
    }

    public static double of(Instant instant) {
        return instant.toEpochMilli() / MILLIS_PER_DAY + UNIX_EPOCH_JD;
    }

    public static Instant toInstant(double julianDay) {
        return Instant.ofEpochMilli(Math.round((julianDay - UNIX_EPOCH_JD) * MILLIS_PER_DAY));
    }

    public static double daysSinceJ2000(Instant instant) {
        return of(instant) - J2000;
    }

    public static double centuriesSinceJ2000(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    public static double centuriesSinceJ2000(Instant instant) {
        return centuriesSinceJ2000(of(instant));
    }

    // Greenwich mean sidereal time in degrees, IAU 1982 expression.
    public static double greenwichSiderealDegrees(double julianDay) {
        double t = centuriesSinceJ2000(julianDay);
        double theta = 280.46061837
                + 360.98564736629 * (julianDay - J2000)
                + 0.000387933 * t * t
                - t * t * t / 38_710_000.0;
        return AngleMath.normalize(theta);
    }
}
