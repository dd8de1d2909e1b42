package com.skybrief.service;

import com.skybrief.core.bus.EventBus;
import com.skybrief.core.calendar.CelestialCalendar;
import com.skybrief.core.events.AggregationCompleted;
import com.skybrief.core.events.SourceResolved;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.Provenance;
import com.skybrief.core.model.TwilightPhase;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.service.briefing.DailyBriefing;
import com.skybrief.service.briefing.TonightSummary;
import com.skybrief.service.config.EngineConfig;
import com.skybrief.service.support.EventCapture;
import com.skybrief.service.support.RoutingFetcher;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BriefingServiceTest {
    private static final ZonedDateTime AUGUST_NIGHT = ZonedDateTime.parse("2026-08-12T23:00:00-04:00");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-08-13T03:00:00Z"), ZoneOffset.UTC);

    @Test
    void offlineBriefingNeedsNoNetwork() {
        RoutingFetcher fetcher = new RoutingFetcher();
        EventBus bus = new EventBus();
        EventCapture events = new EventCapture(bus);

        try (BriefingService service = service(EngineConfig.defaults().offline(), fetcher, bus)) {
            DailyBriefing briefing = service.aggregate(40.7128, -74.006, AUGUST_NIGHT);

            assertEquals(List.of(), fetcher.requests());
            assertEquals(Domain.values().length, briefing.aggregation().results().size());
            assertTrue(briefing.narrative().startsWith("Sky briefing for Wednesday, August 12, 2026."));
            assertTrue(briefing.narrative().contains("Perseids"));
            assertTrue(briefing.narrative().endsWith("Data is currently unavailable for space weather, cloud cover, and ISS passes."));
            assertTrue(briefing.viewingScore().isPresent());
            Map<String, Object> tree = briefing.asMap();
            for (Domain domain : Domain.values()) {
                assertTrue(tree.containsKey(domain.key()), domain.key());
            }
        }

        assertEquals(Domain.values().length, events.byType(SourceResolved.class).size());
        AggregationCompleted completed = events.byType(AggregationCompleted.class).get(0);
        assertEquals(0, completed.live());
        assertEquals(3, completed.unavailable());
    }

    @Test
    void failingLiveSourcesDegradeInsteadOfFailing() {
        RoutingFetcher fetcher = new RoutingFetcher();

        try (BriefingService service = service(EngineConfig.defaults(), fetcher, new EventBus())) {
            DailyBriefing briefing = service.aggregate(new GeoLocation(40.7128, -74.006, null, ZoneOffset.ofHours(-4)), AUGUST_NIGHT);

            assertFalse(fetcher.requests().isEmpty());
            assertEquals(Provenance.LOCAL_FALLBACK, briefing.aggregation().moon().provenance());
            assertEquals(FailureReason.NETWORK_ERROR, briefing.aggregation().moon().reason());
            assertEquals(Provenance.UNAVAILABLE, briefing.aggregation().weather().provenance());
            assertEquals(List.of(Domain.SPACE_WEATHER, Domain.WEATHER, Domain.ISS_PASSES), briefing.aggregation().unavailableDomains());
            assertFalse(briefing.narrative().isBlank());
        }
    }

    @Test
    void sameInstantWrittenInAnyZoneGivesTheSameBriefing() {
        GeoLocation sydney = GeoLocation.of(-33.87, 151.21);
        ZonedDateTime morning = ZonedDateTime.parse("2026-03-20T21:30:00Z");

        try (BriefingService service = service(EngineConfig.defaults().offline(), new RoutingFetcher(), new EventBus())) {
            DailyBriefing inUtc = service.aggregate(sydney, morning);
            DailyBriefing inSydney = service.aggregate(sydney, morning.withZoneSameInstant(ZoneOffset.ofHours(10)));

            ViewingConditionsScore score = inUtc.viewingScore().orElseThrow();
            assertEquals(TwilightPhase.DAY, score.darkness());
            assertEquals(score, inSydney.viewingScore().orElseThrow());
            assertEquals(inUtc.asMap(), inSydney.asMap());
            assertTrue(inUtc.narrative().startsWith("Sky briefing for Saturday, March 21, 2026."));
        }
    }

    @Test
    void invalidCoordinatesFailBeforeAnyWork() {
        RoutingFetcher fetcher = new RoutingFetcher();

        try (BriefingService service = service(EngineConfig.defaults(), fetcher, new EventBus())) {
            assertThrows(IllegalArgumentException.class, () -> service.aggregate(95.0, 0.0, AUGUST_NIGHT));
            assertThrows(IllegalArgumentException.class, () -> service.aggregate(0.0, 181.0, AUGUST_NIGHT));
        }
        assertEquals(List.of(), fetcher.requests());
    }

    @Test
    void tonightSummaryUsesTheSameAggregation() {
        try (BriefingService service = service(EngineConfig.defaults().offline(), new RoutingFetcher(), new EventBus())) {
            TonightSummary summary = service.tonight(new GeoLocation(40.7128, -74.006, 10.0, ZoneOffset.ofHours(-4)), AUGUST_NIGHT);

            assertTrue(summary.narrative().startsWith("Tonight:"));
            assertEquals(List.of(Domain.SPACE_WEATHER, Domain.WEATHER, Domain.ISS_PASSES), summary.unavailable());
            assertTrue(summary.activeShowers().stream().anyMatch(s -> s.shower().name().equals("Perseids")));
            assertEquals("-04:00", summary.asMap().get("display_zone"));
        }
    }

    private static BriefingService service(EngineConfig config, RoutingFetcher fetcher, EventBus bus) {
        return BriefingService.create(config, fetcher, CelestialCalendar.standard(), bus, CLOCK);
    }
}
