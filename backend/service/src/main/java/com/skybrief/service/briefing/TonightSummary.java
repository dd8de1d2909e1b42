package com.skybrief.service.briefing;

import com.skybrief.core.model.CloudCover;
import com.skybrief.core.model.DarkSkyWindow;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.IssPass;
import com.skybrief.core.model.MoonState;
import com.skybrief.core.model.PlanetVisibility;
import com.skybrief.core.model.ShowerActivity;
import com.skybrief.core.model.SpaceWeather;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.core.util.JsonUtils;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// Nullable components are domains that were unavailable for this run.
public record TonightSummary(
        GeoLocation location,
        ZonedDateTime at,
        ZoneId displayZone,
        MoonState moon,
        DarkSkyWindow darkWindow,
        List<PlanetVisibility> visiblePlanets,
        List<IssPass> issPasses,
        List<ShowerActivity> activeShowers,
        SpaceWeather spaceWeather,
        CloudCover cloudCover,
        ViewingConditionsScore score,
        List<Domain> unavailable,
        String narrative
) {
    public TonightSummary {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(at, "at is required");
        Objects.requireNonNull(displayZone, "displayZone is required");
        Objects.requireNonNull(narrative, "narrative is required");
        visiblePlanets = List.copyOf(visiblePlanets);
        issPasses = List.copyOf(issPasses);
        activeShowers = List.copyOf(activeShowers);
        unavailable = List.copyOf(unavailable);
    }

    public Map<String, Object> asMap() {
        return BriefingTree.tonight(this);
    }

    public String toJson() {
        return JsonUtils.toPrettyJson(asMap());
    }
}
