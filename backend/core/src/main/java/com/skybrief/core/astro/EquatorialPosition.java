package com.skybrief.core.astro;

/**
 * Apparent geocentric position. Angles in degrees, distance in AU (kilometres for the moon).
 */
public record EquatorialPosition(double rightAscension, double declination, double distance) {
    public double altitudeDegrees(double latitude, double longitude, double julianDay) {
        double hourAngle = JulianDate.greenwichSiderealDegrees(julianDay) + longitude - rightAscension;
        double sinAltitude = AngleMath.sin(latitude) * AngleMath.sin(declination)
                + AngleMath.cos(latitude) * AngleMath.cos(declination) * AngleMath.cos(hourAngle);
        return Math.toDegrees(Math.asin(AngleMath.clamp(sinAltitude, -1.0, 1.0)));
    }

    static EquatorialPosition fromEcliptic(double longitude, double latitude, double distance, double obliquity) {
        double x = AngleMath.cos(latitude) * AngleMath.cos(longitude);
        double y = AngleMath.cos(latitude) * AngleMath.sin(longitude);
        double z = AngleMath.sin(latitude);
        return fromEclipticVector(x, y, z, distance, obliquity);
    }

    static EquatorialPosition fromEclipticVector(double x, double y, double z, double distance, double obliquity) {
        double yEq = y * AngleMath.cos(obliquity) - z * AngleMath.sin(obliquity);
        double zEq = y * AngleMath.sin(obliquity) + z * AngleMath.cos(obliquity);
        double norm = Math.sqrt(x * x + yEq * yEq + zEq * zEq);
        double ra = AngleMath.normalize(Math.toDegrees(Math.atan2(yEq, x)));
        double dec = Math.toDegrees(Math.asin(AngleMath.clamp(zEq / norm, -1.0, 1.0)));
        return new EquatorialPosition(ra, dec, distance);
    }
}
