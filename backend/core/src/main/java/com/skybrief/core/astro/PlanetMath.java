package com.skybrief.core.astro;

import com.skybrief.core.model.Planet;
import com.skybrief.core.model.ViewingWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mean Keplerian elements (JPL, valid 1800-2050) propagated without perturbations.
 * Magnitudes follow the Astronomical Almanac expressions; Saturn ignores its rings.
 */
public final class PlanetMath {
    public static final double MIN_ELONGATION = 15.0;
    public static final double NAKED_EYE_LIMIT = 6.0;
    public static final double ALL_NIGHT_ELONGATION = 150.0;
    public static final double RISE_ALTITUDE = 0.0;

    private static final double OBLIQUITY_J2000 = 23.43928;
    private static final Duration SCAN_STEP = Duration.ofMinutes(20);
    private static final int KEPLER_ITERATIONS = 12;

    private static final OrbitalElements EARTH_MOON_BARYCENTER = new OrbitalElements(
            1.00000261, 0.00000562, 0.01671123, -0.00004392, -0.00001531, -0.01294668,
            100.46457166, 35999.37244981, 102.93768193, 0.32327364, 0.0, 0.0);

    private static final Map<Planet, OrbitalElements> ELEMENTS = new EnumMap<>(Planet.class);

    static {
        ELEMENTS.put(Planet.MERCURY, new OrbitalElements(
                0.38709927, 0.00000037, 0.20563593, 0.00001906, 7.00497902, -0.00594749,
                252.25032350, 149472.67411175, 77.45779628, 0.16047689, 48.33076593, -0.12534081));
        ELEMENTS.put(Planet.VENUS, new OrbitalElements(
                0.72333566, 0.00000390, 0.00677672, -0.00004107, 3.39467605, -0.00078890,
                181.97909950, 58517.81538729, 131.60246718, 0.00268329, 76.67984255, -0.27769418));
        ELEMENTS.put(Planet.MARS, new OrbitalElements(
                1.52371034, 0.00001847, 0.09339410, 0.00007882, 1.84969142, -0.00813131,
                -4.55343205, 19140.30268499, -23.94362959, 0.44441088, 49.55953891, -0.29257343));
        ELEMENTS.put(Planet.JUPITER, new OrbitalElements(
                5.20288700, -0.00011607, 0.04838624, -0.00013253, 1.30439695, -0.00183714,
                34.39644051, 3034.74612775, 14.72847983, 0.21252668, 100.47390909, 0.20469106));
        ELEMENTS.put(Planet.SATURN, new OrbitalElements(
                9.53667594, -0.00125060, 0.05386179, -0.00050991, 2.48599187, 0.00193609,
                49.95424423, 1222.49362201, 92.59887831, -0.41897216, 113.66242448, -0.28867794));
        ELEMENTS.put(Planet.URANUS, new OrbitalElements(
                19.18916464, -0.00196176, 0.04725744, -0.00004397, 0.77263783, -0.00242939,
                313.23810451, 428.48202785, 170.95427630, 0.40805281, 74.01692503, 0.04240589));
        ELEMENTS.put(Planet.NEPTUNE, new OrbitalElements(
                30.06992276, 0.00026291, 0.00859048, 0.00005105, 1.77004347, 0.00035372,
                -55.12002969, 218.45945325, 44.96476227, -0.32241464, 131.78422574, -0.00508664));
    }

    private PlanetMath() {
    }

    public static PlanetPosition position(Planet planet, double julianDay) {
        double t = JulianDate.centuriesSinceJ2000(julianDay);
        double[] earth = EARTH_MOON_BARYCENTER.heliocentric(t);
        double[] body = ELEMENTS.get(planet).heliocentric(t);

        double gx = body[0] - earth[0];
        double gy = body[1] - earth[1];
        double gz = body[2] - earth[2];
        double r = norm(body);
        double delta = Math.sqrt(gx * gx + gy * gy + gz * gz);
        double earthSun = norm(earth);

        double phaseAngle = Math.toDegrees(Math.acos(AngleMath.clamp(
                (r * r + delta * delta - earthSun * earthSun) / (2 * r * delta), -1.0, 1.0)));
        double elongation = Math.toDegrees(Math.acos(AngleMath.clamp(
                (earthSun * earthSun + delta * delta - r * r) / (2 * earthSun * delta), -1.0, 1.0)));

        double planetLongitude = Math.toDegrees(Math.atan2(gy, gx));
        double sunLongitude = Math.toDegrees(Math.atan2(-earth[1], -earth[0]));
        boolean eastOfSun = AngleMath.normalizeSigned(planetLongitude - sunLongitude) > 0;

        EquatorialPosition equatorial = EquatorialPosition.fromEclipticVector(gx, gy, gz, delta, OBLIQUITY_J2000);
        return new PlanetPosition(
                planet,
                equatorial,
                r,
                phaseAngle,
                elongation,
                eastOfSun,
                magnitude(planet, r, delta, phaseAngle)
        );
    }

    public static PlanetPosition position(Planet planet, Instant instant) {
        return position(planet, JulianDate.of(instant));
    }

    public static double magnitude(Planet planet, double sunDistance, double earthDistance, double phaseAngle) {
        double base = 5 * Math.log10(sunDistance * earthDistance);
        double i = phaseAngle;
        return switch (planet) {
            case MERCURY -> -0.42 + base + 0.0380 * i - 0.000273 * i * i + 0.000002 * i * i * i;
            case VENUS -> -4.40 + base + 0.0009 * i + 0.000239 * i * i - 0.00000065 * i * i * i;
            case MARS -> -1.52 + base + 0.016 * i;
            case JUPITER -> -9.40 + base + 0.005 * i;
            case SATURN -> -8.88 + base + 0.044 * i;
            case URANUS -> -7.19 + base;
            case NEPTUNE -> -6.87 + base;
        };
    }

    public static boolean isVisible(double elongation, double magnitude) {
        return elongation >= MIN_ELONGATION && magnitude <= NAKED_EYE_LIMIT;
    }

    public static ViewingWindow windowFor(double elongation, double magnitude, boolean eastOfSun) {
        if (!isVisible(elongation, magnitude)) {
            return ViewingWindow.NOT_VISIBLE;
        }
        if (elongation > ALL_NIGHT_ELONGATION) {
            return ViewingWindow.ALL_NIGHT;
        }
        return eastOfSun ? ViewingWindow.EVENING : ViewingWindow.MORNING;
    }

    public static String bestViewingHint(ViewingWindow window, double elongation) {
        return switch (window) {
            case ALL_NIGHT -> "Rises around sunset and sets around sunrise";
            case EVENING -> elongation > 90 ? "Best in the evening, high after sunset" : "Look west after sunset";
            case MORNING -> elongation > 90 ? "Best in the morning, high before sunrise" : "Look east before sunrise";
            case NOT_VISIBLE -> null;
        };
    }

    public static double altitude(Planet planet, double latitude, double longitude, Instant instant) {
        double jd = JulianDate.of(instant);
        return position(planet, jd).equatorial().altitudeDegrees(latitude, longitude, jd);
    }

    // Planets move slowly enough that the position at the window midpoint serves the whole day.
    public static RiseSet riseAndSet(
            Planet planet,
            double latitude,
            double longitude,
            Instant windowStart,
            Instant windowEnd
    ) {
        Instant middle = windowStart.plus(Duration.between(windowStart, windowEnd).dividedBy(2));
        EquatorialPosition fixed = position(planet, middle).equatorial();
        return CrossingSearch.scan(
                t -> fixed.altitudeDegrees(latitude, longitude, JulianDate.of(t)),
                windowStart,
                windowEnd,
                SCAN_STEP,
                RISE_ALTITUDE
        );
    }

    private static double norm(double[] vector) {
        return Math.sqrt(vector[0] * vector[0] + vector[1] * vector[1] + vector[2] * vector[2]);
    }

    private record OrbitalElements(
            double semiMajorAxis,
            double semiMajorAxisRate,
            double eccentricity,
            double eccentricityRate,
            double inclination,
            double inclinationRate,
            double meanLongitude,
            double meanLongitudeRate,
            double perihelionLongitude,
            double perihelionLongitudeRate,
            double nodeLongitude,
            double nodeLongitudeRate
    ) {
        double[] heliocentric(double centuries) {
            double a = semiMajorAxis + semiMajorAxisRate * centuries;
            double e = eccentricity + eccentricityRate * centuries;
            double inc = inclination + inclinationRate * centuries;
            double l = meanLongitude + meanLongitudeRate * centuries;
            double perihelion = perihelionLongitude + perihelionLongitudeRate * centuries;
            double node = nodeLongitude + nodeLongitudeRate * centuries;

            double argumentOfPerihelion = perihelion - node;
            double meanAnomaly = Math.toRadians(AngleMath.normalizeSigned(l - perihelion));
            double eccentricAnomaly = meanAnomaly + e * Math.sin(meanAnomaly);
            for (int i = 0; i < KEPLER_ITERATIONS; i++) {
                double delta = (eccentricAnomaly - e * Math.sin(eccentricAnomaly) - meanAnomaly)
                        / (1 - e * Math.cos(eccentricAnomaly));
                eccentricAnomaly -= delta;
                if (Math.abs(delta) < 1e-10) {
                    break;
                }
            }

            double xOrbit = a * (Math.cos(eccentricAnomaly) - e);
            double yOrbit = a * Math.sqrt(1 - e * e) * Math.sin(eccentricAnomaly);

            double cw = AngleMath.cos(argumentOfPerihelion);
            double sw = AngleMath.sin(argumentOfPerihelion);
            double cn = AngleMath.cos(node);
            double sn = AngleMath.sin(node);
            double ci = AngleMath.cos(inc);
            double si = AngleMath.sin(inc);

            return new double[]{
                    (cw * cn - sw * sn * ci) * xOrbit + (-sw * cn - cw * sn * ci) * yOrbit,
                    (cw * sn + sw * cn * ci) * xOrbit + (-sw * sn + cw * cn * ci) * yOrbit,
                    (sw * si) * xOrbit + (cw * si) * yOrbit
            };
        }
    }
}
