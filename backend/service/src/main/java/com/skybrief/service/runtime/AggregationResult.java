package com.skybrief.service.runtime;

import com.skybrief.core.model.CloudCover;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.EclipseOutlook;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.IssPass;
import com.skybrief.core.model.MeteorOutlook;
import com.skybrief.core.model.MoonState;
import com.skybrief.core.model.PlanetVisibility;
import com.skybrief.core.model.Provenance;
import com.skybrief.core.model.SourceResult;
import com.skybrief.core.model.SpaceWeather;
import com.skybrief.core.model.SunTimes;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record AggregationResult(
        GeoLocation location,
        ZonedDateTime at,
        Map<Domain, SourceResult<?>> results,
        Duration elapsed
) {
    public AggregationResult {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(at, "at is required");
        Objects.requireNonNull(elapsed, "elapsed is required");
        EnumMap<Domain, SourceResult<?>> copy = new EnumMap<>(Domain.class);
        copy.putAll(results);
        for (Domain domain : Domain.values()) {
            if (!copy.containsKey(domain)) {
                throw new IllegalArgumentException("Missing result for domain " + domain);
            }
        }
        results = Collections.unmodifiableMap(copy);
    }

    public SourceResult<?> result(Domain domain) {
        return results.get(domain);
    }

    public SourceResult<MoonState> moon() {
        return typed(Domain.MOON);
    }

    public SourceResult<SunTimes> sun() {
        return typed(Domain.SUN);
    }

    public SourceResult<List<PlanetVisibility>> planets() {
        return typed(Domain.PLANETS);
    }

    public SourceResult<MeteorOutlook> meteorShowers() {
        return typed(Domain.METEOR_SHOWERS);
    }

    public SourceResult<EclipseOutlook> eclipses() {
        return typed(Domain.ECLIPSES);
    }

    public SourceResult<SpaceWeather> spaceWeather() {
        return typed(Domain.SPACE_WEATHER);
    }

    public SourceResult<CloudCover> weather() {
        return typed(Domain.WEATHER);
    }

    public SourceResult<List<IssPass>> issPasses() {
        return typed(Domain.ISS_PASSES);
    }

    public Map<Provenance, List<Domain>> provenanceSummary() {
        Map<Provenance, List<Domain>> summary = new EnumMap<>(Provenance.class);
        for (Provenance provenance : Provenance.values()) {
            summary.put(provenance, new ArrayList<>());
        }
        results.forEach((domain, result) -> summary.get(result.provenance()).add(domain));
        summary.replaceAll((provenance, domains) -> List.copyOf(domains));
        return summary;
    }

    public List<Domain> unavailableDomains() {
        return provenanceSummary().get(Provenance.UNAVAILABLE);
    }

    public long count(Provenance provenance) {
        return results.values().stream().filter(result -> result.provenance() == provenance).count();
    }

    @SuppressWarnings("unchecked")
    private <T> SourceResult<T> typed(Domain domain) {
        return (SourceResult<T>) results.get(domain);
    }
}
