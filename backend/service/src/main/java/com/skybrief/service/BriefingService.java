package com.skybrief.service;

import com.skybrief.calculators.api.JsonFetcher;
import com.skybrief.calculators.http.HttpJsonFetcher;
import com.skybrief.core.bus.EventBus;
import com.skybrief.core.calendar.CelestialCalendar;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.service.briefing.BriefingSynthesizer;
import com.skybrief.service.briefing.DailyBriefing;
import com.skybrief.service.briefing.TonightSummary;
import com.skybrief.service.config.EngineConfig;
import com.skybrief.service.runtime.AggregationResult;
import com.skybrief.service.runtime.SourceOrchestrator;
import com.skybrief.service.runtime.StandardCalculators;
import com.skybrief.service.scoring.ScoringInputs;
import com.skybrief.service.scoring.ViewingConditionsScorer;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.logging.Logger;

public class BriefingService implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(BriefingService.class.getName());
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final SourceOrchestrator orchestrator;
    private final ViewingConditionsScorer scorer;
    private final BriefingSynthesizer synthesizer;

    public BriefingService(SourceOrchestrator orchestrator, ViewingConditionsScorer scorer, BriefingSynthesizer synthesizer) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer is required");
    }

    public static BriefingService create(EngineConfig config, EventBus eventBus, Clock clock) {
        return create(config, HttpJsonFetcher.create(CONNECT_TIMEOUT), CelestialCalendar.standard(), eventBus, clock);
    }

    public static BriefingService create(
            EngineConfig config,
            JsonFetcher fetcher,
            CelestialCalendar calendar,
            EventBus eventBus,
            Clock clock
    ) {
        SourceOrchestrator orchestrator = new SourceOrchestrator(
                StandardCalculators.create(config, calendar),
                config,
                fetcher,
                eventBus,
                clock
        );
        return new BriefingService(orchestrator, new ViewingConditionsScorer(), new BriefingSynthesizer());
    }

    public DailyBriefing aggregate(GeoLocation location, ZonedDateTime at) {
        AggregationResult aggregation = orchestrator.aggregate(location, at);
        return synthesizer.synthesize(aggregation, score(aggregation));
    }

    // The location is validated before any calculator runs.
    public DailyBriefing aggregate(double latitude, double longitude, ZonedDateTime at) {
        return aggregate(GeoLocation.of(latitude, longitude), at);
    }

    public TonightSummary tonight(GeoLocation location, ZonedDateTime at) {
        AggregationResult aggregation = orchestrator.aggregate(location, at);
        return synthesizer.tonight(aggregation, score(aggregation));
    }

    private ViewingConditionsScore score(AggregationResult aggregation) {
        ViewingConditionsScore score = scorer.score(ScoringInputs.from(aggregation)).orElse(null);
        if (score == null) {
            LOGGER.info("No scoring factor available; viewing score omitted");
        }
        return score;
    }

    @Override
    public void close() {
        orchestrator.close();
    }
}
