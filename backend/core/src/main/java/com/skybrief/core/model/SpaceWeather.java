package com.skybrief.core.model;

import java.time.Instant;
import java.util.Objects;

public record SpaceWeather(
        double kpIndex,
        double kpMax24h,
        GeomagActivity activity,
        Double solarWindSpeedKmPerSecond,
        Double solarWindDensity,
        double auroraVisibilityLatitude,
        boolean auroraVisible,
        Instant observedAt
) {
    public static final double MIN_VISIBILITY_LATITUDE = 40.0;

    public SpaceWeather {
        Objects.requireNonNull(activity, "activity is required");
        if (Double.isNaN(kpIndex) || kpIndex < 0 || kpIndex > 9) {
            throw new IllegalArgumentException("Kp must be within [0, 9]: " + kpIndex);
        }
    }

    // Auroral oval edge moves about three degrees equatorward per Kp step.
    public static double visibilityLatitude(double kp) {
        return Math.max(MIN_VISIBILITY_LATITUDE, 67.0 - kp * 3.0);
    }

    public static SpaceWeather of(
            double kpIndex,
            double kpMax24h,
            Double windSpeed,
            Double windDensity,
            double observerLatitude,
            Instant observedAt
    ) {
        double maxKp = Math.max(kpIndex, kpMax24h);
        double visibility = visibilityLatitude(maxKp);
        return new SpaceWeather(
                kpIndex,
                maxKp,
                GeomagActivity.fromKp(maxKp),
                windSpeed,
                windDensity,
                visibility,
                Math.abs(observerLatitude) >= visibility,
                observedAt
        );
    }
}
