package com.skybrief.service.scoring;

import com.skybrief.core.astro.SolarMath;
import com.skybrief.core.model.CloudCover;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.MoonState;
import com.skybrief.core.model.SpaceWeather;
import com.skybrief.core.model.SunTimes;
import com.skybrief.core.model.TwilightPhase;
import com.skybrief.service.runtime.AggregationResult;

import java.time.Instant;

/**
 * The subset of an aggregation the scorer reads. Null means the factor is absent. Darkness is the
 * sun's depression at the instant itself, so it does not depend on which solar day was reported.
 */
public record ScoringInputs(
        Double cloudCoverPercent,
        Double moonIllumination,
        Boolean moonUp,
        Double kpIndex,
        TwilightPhase darkness
) {
    public static ScoringInputs from(AggregationResult aggregation) {
        Instant instant = aggregation.at().toInstant();
        GeoLocation location = aggregation.location();
        CloudCover cloud = aggregation.weather().value();
        MoonState moon = aggregation.moon().value();
        SpaceWeather space = aggregation.spaceWeather().value();
        SunTimes sun = aggregation.sun().value();
        return new ScoringInputs(
                cloud == null ? null : cloud.percentAtInstant(),
                moon == null ? null : moon.illumination(),
                moon == null ? null : moon.isUp(),
                space == null ? null : space.kpIndex(),
                sun == null ? null : SolarMath.twilightPhase(location.latitude(), location.longitude(), instant)
        );
    }
}
