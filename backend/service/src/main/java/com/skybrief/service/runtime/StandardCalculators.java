package com.skybrief.service.runtime;

import com.skybrief.calculators.api.Calculator;
import com.skybrief.calculators.eclipses.EclipseCalculator;
import com.skybrief.calculators.iss.IssPassCalculator;
import com.skybrief.calculators.meteors.MeteorShowerCalculator;
import com.skybrief.calculators.moon.MoonCalculator;
import com.skybrief.calculators.planets.PlanetCalculator;
import com.skybrief.calculators.spaceweather.SpaceWeatherCalculator;
import com.skybrief.calculators.sun.SunCalculator;
import com.skybrief.calculators.weather.CloudCoverCalculator;
import com.skybrief.core.calendar.CelestialCalendar;
import com.skybrief.core.model.Domain;
import com.skybrief.service.config.EngineConfig;

import java.util.List;

public final class StandardCalculators {
    private StandardCalculators() {
    }

    public static List<Calculator<?>> create(EngineConfig config, CelestialCalendar calendar) {
        return List.of(
                new MoonCalculator(config.endpointFor(Domain.MOON).orElse(MoonCalculator.DEFAULT_ENDPOINT)),
                new SunCalculator(config.endpointFor(Domain.SUN).orElse(SunCalculator.DEFAULT_ENDPOINT)),
                new PlanetCalculator(config.endpointFor(Domain.PLANETS).orElse(PlanetCalculator.DEFAULT_ENDPOINT)),
                new MeteorShowerCalculator(calendar),
                new EclipseCalculator(calendar),
                new SpaceWeatherCalculator(
                        config.endpointFor(Domain.SPACE_WEATHER).orElse(SpaceWeatherCalculator.DEFAULT_KP_ENDPOINT),
                        SpaceWeatherCalculator.DEFAULT_FORECAST_ENDPOINT,
                        SpaceWeatherCalculator.DEFAULT_PLASMA_ENDPOINT
                ),
                new CloudCoverCalculator(config.endpointFor(Domain.WEATHER).orElse(CloudCoverCalculator.DEFAULT_ENDPOINT)),
                new IssPassCalculator(
                        config.endpointFor(Domain.ISS_PASSES).orElse(IssPassCalculator.DEFAULT_ENDPOINT),
                        config.apiKeyFor(Domain.ISS_PASSES).orElse(null)
                )
        );
    }
}
