package com.skybrief.service.briefing;

import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.core.util.JsonUtils;
import com.skybrief.service.runtime.AggregationResult;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything known about the sky for one (location, instant). A null score means no scoring factor
 * was available.
 */
public record DailyBriefing(AggregationResult aggregation, ViewingConditionsScore score, String narrative) {
    public DailyBriefing {
        Objects.requireNonNull(aggregation, "aggregation is required");
        Objects.requireNonNull(narrative, "narrative is required");
    }

    public GeoLocation location() {
        return aggregation.location();
    }

    public ZonedDateTime at() {
        return aggregation.at();
    }

    public ZoneId displayZone() {
        return aggregation.location().localOffset();
    }

    public Optional<ViewingConditionsScore> viewingScore() {
        return Optional.ofNullable(score);
    }

    public Map<String, Object> asMap() {
        return BriefingTree.daily(this);
    }

    public String toJson() {
        return JsonUtils.toPrettyJson(asMap());
    }
}
