package com.skybrief.core.astro;

import com.skybrief.core.model.Planet;

public record PlanetPosition(
        Planet planet,
        EquatorialPosition equatorial,
        double heliocentricDistance,
        double phaseAngle,
        double elongation,
        boolean eastOfSun,
        double magnitude
) {
}
