package com.skybrief.service.briefing;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.MeteorOutlook;
import com.skybrief.core.model.SourceResult;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.core.util.JsonUtils;
import com.skybrief.service.runtime.AggregationResult;
import com.skybrief.service.scoring.ScoringInputs;
import com.skybrief.service.scoring.ViewingConditionsScorer;
import com.skybrief.service.support.SampleSky;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class BriefingSynthesizerTest {
    private final BriefingSynthesizer synthesizer = new BriefingSynthesizer();
    private final ViewingConditionsScorer scorer = new ViewingConditionsScorer();

    @Test
    void dailyNarrativeReadsAsContinuousProse() {
        DailyBriefing briefing = daily(SampleSky.evening().build());

        assertEquals("Sky briefing for Monday, October 19, 2026."
                + " Sunrise at 7:52 AM, sunset at 6:12 PM (10 hours 20 minutes of daylight)."
                + " Moon: First Quarter (55% illuminated), rises 2:30 PM and sets 12:10 AM."
                + " The ISS passes over at 7:41 PM for 5 minutes."
                + " Jupiter and Saturn are visible."
                + " The Orionids meteor shower is active."
                + " Space weather is active (Kp 4) - aurora possible at high latitudes."
                + " Viewing conditions are good (69/100) - clear skies.", briefing.narrative());
        assertFalse(briefing.narrative().contains("\n"));
    }

    @Test
    void quietSkyLeavesOutShowerAndSpaceWeatherSentences() {
        DailyBriefing briefing = daily(SampleSky.evening()
                .with(Domain.METEOR_SHOWERS, SourceResult.local(new MeteorOutlook(List.of(), List.of(SampleSky.leonids()))))
                .with(Domain.SPACE_WEATHER, SourceResult.unavailable(FailureReason.TIMEOUT, "No answer within 8000 ms"))
                .build());

        assertFalse(briefing.narrative().contains("meteor"));
        assertFalse(briefing.narrative().contains("Space weather"));
        assertTrue(briefing.narrative().endsWith("Data is currently unavailable for space weather."));
    }

    @Test
    void unavailableDomainsAreCaveatedNotGuessed() {
        DailyBriefing briefing = daily(SampleSky.evening()
                .unavailable(Domain.SUN, FailureReason.MALFORMED_PAYLOAD)
                .unavailable(Domain.WEATHER, FailureReason.HTTP_STATUS)
                .build());

        assertFalse(briefing.narrative().contains("Sunrise"));
        assertFalse(briefing.narrative().contains("skies"));
        assertTrue(briefing.narrative().endsWith("Data is currently unavailable for sun times and cloud cover."));
    }

    @Test
    void nothingAvailableSaysSo() {
        AggregationResult aggregation = SampleSky.evening().allUnavailable().build();
        DailyBriefing briefing = daily(aggregation);

        assertTrue(briefing.viewingScore().isEmpty());
        assertEquals("Sky briefing for Monday, October 19, 2026. " + NarrativeWriter.NO_DATA, briefing.narrative());
        assertEquals("Tonight: " + NarrativeWriter.NO_DATA, tonight(aggregation).narrative());
    }

    @Test
    @SuppressWarnings("unchecked")
    void polarNightIsReportedAsAValidResult() {
        DailyBriefing briefing = daily(SampleSky.evening()
                .with(Domain.SUN, SourceResult.local(SampleSky.polarNight()))
                .build());

        assertTrue(briefing.narrative().contains("The sun does not rise today."));
        Map<String, Object> sun = (Map<String, Object>) ((Map<String, Object>) briefing.asMap().get("sun")).get("value");
        assertEquals(Map.of("status", "always_below", "time", "null"), stringified((Map<String, Object>) sun.get("sunrise")));
        assertEquals(0L, sun.get("day_length_minutes"));
    }

    @Test
    void treeHoldsOnlyPrimitiveLeaves() {
        DailyBriefing briefing = daily(SampleSky.evening()
                .unavailable(Domain.WEATHER, FailureReason.TIMEOUT)
                .build());

        assertPrimitiveLeaves(briefing.asMap(), "briefing");
        assertPrimitiveLeaves(tonight(SampleSky.evening().build()).asMap(), "tonight");
    }

    @Test
    @SuppressWarnings("unchecked")
    void treeCarriesProvenanceAndDisplayZoneTimes() {
        Map<String, Object> tree = daily(SampleSky.evening()
                .unavailable(Domain.SPACE_WEATHER, FailureReason.TIMEOUT)
                .build()).asMap();

        assertEquals("-04:00", tree.get("display_zone"));
        assertEquals("2026-10-19T22:00:00-04:00", tree.get("calculated_for"));

        Map<String, Object> moon = (Map<String, Object>) tree.get("moon");
        assertEquals("live", moon.get("provenance"));
        assertNull(moon.get("reason"));
        Map<String, Object> moonValue = (Map<String, Object>) moon.get("value");
        assertEquals("First Quarter", moonValue.get("phase"));
        assertEquals(Map.of("status", "occurs", "time", "2026-10-19T14:30:00-04:00"), moonValue.get("rise"));

        Map<String, Object> planets = (Map<String, Object>) tree.get("planets");
        assertEquals("local_fallback", planets.get("provenance"));
        assertEquals("timeout", planets.get("reason"));

        Map<String, Object> space = (Map<String, Object>) tree.get("space_weather");
        assertEquals("unavailable", space.get("provenance"));
        assertEquals("timeout", space.get("reason"));
        assertTrue(space.containsKey("value"));
        assertNull(space.get("value"));

        Map<String, Object> provenance = (Map<String, Object>) tree.get("provenance");
        assertEquals(List.of("space_weather"), provenance.get("unavailable"));
        assertEquals(List.of("planets", "meteor_showers", "eclipses"), provenance.get("local_fallback"));

        Map<String, Object> iss = (Map<String, Object>) tree.get("iss_passes");
        assertEquals("live", iss.get("provenance"));
        Map<String, Object> pass = ((List<Map<String, Object>>) iss.get("value")).get(0);
        assertEquals("2026-10-19T19:41:10-04:00", pass.get("start"));
        assertEquals(300L, pass.get("duration_seconds"));

        Map<String, Object> score = (Map<String, Object>) tree.get("viewing_score");
        assertEquals("Good", score.get("category"));
        assertEquals(2, ((List<Object>) score.get("breakdown")).size());
    }

    @Test
    void jsonRenderingKeepsExplicitNulls() throws Exception {
        DailyBriefing briefing = daily(SampleSky.evening()
                .unavailable(Domain.WEATHER, FailureReason.NETWORK_ERROR)
                .build());

        JsonNode json = JsonUtils.objectMapper().readTree(briefing.toJson());

        assertEquals(briefing.narrative(), json.get("narrative").asText());
        assertTrue(json.get("weather").get("value").isNull());
        // Moon and Kp only: 34.2 * 0.7 + 83.3 * 0.3
        assertEquals(49, json.get("viewing_score").get("value").asInt());
    }

    @Test
    void issPassesSplitBetweenTodayAndTonight() {
        AggregationResult aggregation = SampleSky.evening()
                .with(Domain.ISS_PASSES, SourceResult.live(List.of(SampleSky.eveningPass(), SampleSky.dawnPass())))
                .build();

        assertTrue(daily(aggregation).narrative().contains(" The ISS passes over at 7:41 PM for 5 minutes. "));
        TonightSummary summary = tonight(aggregation);
        assertTrue(summary.narrative().contains(" The ISS has 2 visible passes tonight. "));
        assertEquals(2, summary.issPasses().size());
    }

    @Test
    void noIssSentenceWithoutPasses() {
        AggregationResult empty = SampleSky.evening().with(Domain.ISS_PASSES, SourceResult.live(List.of())).build();
        AggregationResult unavailable = SampleSky.evening().unavailable(Domain.ISS_PASSES, FailureReason.NO_FALLBACK).build();

        assertFalse(daily(empty).narrative().contains("ISS"));
        assertFalse(tonight(empty).narrative().contains("ISS"));
        assertTrue(daily(unavailable).narrative().endsWith("Data is currently unavailable for ISS passes."));
        assertFalse(tonight(unavailable).narrative().contains("The ISS"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void tonightSummaryIsANarrowerProjection() {
        TonightSummary summary = tonight(SampleSky.evening().build());

        assertEquals("Tonight: First Quarter (55% illuminated) rises at 2:30 PM."
                + " Full darkness runs from 7:39 PM to 6:25 AM, best around 1:02 AM."
                + " The ISS passes over at 7:41 PM for 5 minutes."
                + " Jupiter and Saturn are visible in the evening sky."
                + " The Orionids meteor shower is active."
                + " Aurora activity is active (Kp 4)."
                + " Viewing conditions are good (69/100) - clear skies.", summary.narrative());
        assertEquals(2, summary.visiblePlanets().size());
        assertEquals(List.of(), summary.unavailable());

        Map<String, Object> tree = summary.asMap();
        assertEquals(List.of("Jupiter", "Saturn"), tree.get("visible_planets"));
        assertEquals(List.of("Orionids"), tree.get("active_showers"));
        assertEquals(1, ((List<Object>) tree.get("iss_passes")).size());
        assertFalse(tree.containsKey("eclipses"));
    }

    private DailyBriefing daily(AggregationResult aggregation) {
        return synthesizer.synthesize(aggregation, score(aggregation));
    }

    private TonightSummary tonight(AggregationResult aggregation) {
        return synthesizer.tonight(aggregation, score(aggregation));
    }

    private ViewingConditionsScore score(AggregationResult aggregation) {
        return scorer.score(ScoringInputs.from(aggregation)).orElse(null);
    }

    private static Map<String, String> stringified(Map<String, Object> map) {
        return Map.of("status", String.valueOf(map.get("status")), "time", String.valueOf(map.get("time")));
    }

    private static void assertPrimitiveLeaves(Object node, String path) {
        if (node == null || node instanceof String || node instanceof Number || node instanceof Boolean) {
            return;
        }
        if (node instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                assertTrue(key instanceof String, "non-string key at " + path);
                assertPrimitiveLeaves(value, path + "." + key);
            });
            return;
        }
        if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                assertPrimitiveLeaves(list.get(i), path + "[" + i + "]");
            }
            return;
        }
        fail("Unexpected " + node.getClass().getName() + " at " + path);
    }
}
