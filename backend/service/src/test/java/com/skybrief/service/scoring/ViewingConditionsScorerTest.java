package com.skybrief.service.scoring;

import com.skybrief.core.model.Domain;
import com.skybrief.core.model.FactorContribution;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.ScoreCategory;
import com.skybrief.core.model.ScoreFactor;
import com.skybrief.core.model.TwilightPhase;
import com.skybrief.core.model.ViewingConditionsScore;
import com.skybrief.service.support.SampleSky;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewingConditionsScorerTest {
    private final ViewingConditionsScorer scorer = new ViewingConditionsScorer();

    @Test
    void clearNewMoonNightWithoutKpIsExcellent() {
        ViewingConditionsScore score = scorer.score(new ScoringInputs(0.0, 0.0, true, null, TwilightPhase.NIGHT)).orElseThrow();

        assertEquals(100, score.value());
        assertEquals(ScoreCategory.EXCELLENT, score.category());
        assertEquals(2, score.breakdown().size());
        assertTrue(score.breakdown().stream().noneMatch(f -> f.factor() == ScoreFactor.GEOMAGNETIC));
    }

    @Test
    void singlePresentFactorCarriesTheWholeWeight() {
        ViewingConditionsScore score = scorer.score(new ScoringInputs(40.0, null, null, null, TwilightPhase.NIGHT)).orElseThrow();

        assertEquals(60, score.value());
        assertEquals(ScoreCategory.GOOD, score.category());
        FactorContribution cloud = score.breakdown().get(0);
        assertEquals(ScoreFactor.CLOUD_COVER, cloud.factor());
        assertEquals(50, cloud.weight());
        assertEquals(1.0, cloud.normalizedWeight(), 1e-9);
    }

    @Test
    void allFactorsUseDocumentedWeights() {
        // 80 * 0.5 + 0 * 0.35 + 60 * 0.15
        ViewingConditionsScore score = scorer.score(new ScoringInputs(20.0, 1.0, true, 2.0, TwilightPhase.NIGHT)).orElseThrow();

        assertEquals(49, score.value());
        assertEquals(ScoreCategory.FAIR, score.category());
        assertEquals(49.0, score.breakdownTotal(), 1e-9);
        assertEquals(0.35, score.breakdown().get(1).normalizedWeight(), 1e-9);
    }

    @Test
    void twoMissingFactorsRenormalizeLinearly() {
        // 60 and 100 with weights 35 and 15 -> 0.7 and 0.3
        ViewingConditionsScore score = scorer.score(new ScoringInputs(null, 0.2, true, 6.0, TwilightPhase.NIGHT)).orElseThrow();

        double moon = ViewingConditionsScorer.moonSubScore(0.2, true);
        assertEquals(Math.round(moon * 0.7 + 100 * 0.3), score.value());
        assertEquals(0.7, score.breakdown().get(0).normalizedWeight(), 1e-9);
        assertEquals(0.3, score.breakdown().get(1).normalizedWeight(), 1e-9);
    }

    @Test
    void darknessScalesTheWholeScore() {
        assertEquals(25, scorer.score(new ScoringInputs(0.0, null, null, null, TwilightPhase.DAY)).orElseThrow().value());
        assertEquals(50, scorer.score(new ScoringInputs(0.0, null, null, null, TwilightPhase.CIVIL)).orElseThrow().value());
        assertEquals(75, scorer.score(new ScoringInputs(0.0, null, null, null, TwilightPhase.NAUTICAL)).orElseThrow().value());
        assertEquals(90, scorer.score(new ScoringInputs(0.0, null, null, null, TwilightPhase.ASTRONOMICAL)).orElseThrow().value());
        assertEquals(100, scorer.score(new ScoringInputs(0.0, null, null, null, null)).orElseThrow().value());
    }

    @Test
    void moonBelowHorizonDoesNotPenalise() {
        assertEquals(100.0, ViewingConditionsScorer.moonSubScore(1.0, false), 1e-9);
        assertEquals(0.0, ViewingConditionsScorer.moonSubScore(1.0, true), 1e-9);
        assertEquals(100.0, ViewingConditionsScorer.moonSubScore(0.0, true), 1e-9);
    }

    @Test
    void noFactorsMeansNoScore() {
        Optional<ViewingConditionsScore> score = scorer.score(new ScoringInputs(null, null, null, null, TwilightPhase.NIGHT));

        assertTrue(score.isEmpty());
    }

    @Test
    void scoreStaysInRangeAndBreakdownAddsUp() {
        double[] clouds = {0, 12.5, 50, 87.5, 100};
        double[] illuminations = {0, 0.3, 0.75, 1};
        double[] kps = {0, 3.3, 9};
        for (double cloud : clouds) {
            for (double illumination : illuminations) {
                for (double kp : kps) {
                    for (TwilightPhase phase : TwilightPhase.values()) {
                        ViewingConditionsScore score = scorer.score(new ScoringInputs(cloud, illumination, true, kp, phase)).orElseThrow();
                        assertTrue(score.value() >= 0 && score.value() <= 100);
                        assertEquals(score.value(), score.breakdownTotal(), 0.5);
                        assertEquals(ScoreCategory.fromScore(score.value()), score.category());
                    }
                }
            }
        }
    }

    @Test
    void recommendationsFollowConditions() {
        List<String> cloudy = ViewingConditionsScorer.recommendations(new ScoringInputs(80.0, 0.9, true, null, TwilightPhase.CIVIL));
        assertEquals(List.of(
                "Heavy cloud cover - wait for clearer skies",
                "Bright moon - best for planets and the Moon itself",
                "Not fully dark - brighter objects only"
        ), cloudy);

        List<String> dark = ViewingConditionsScorer.recommendations(new ScoringInputs(10.0, 0.1, true, null, TwilightPhase.NIGHT));
        assertEquals(List.of("Dark moon - great for galaxies and nebulae", "Excellent for deep sky observing!"), dark);
    }

    @Test
    void inputsComeFromAggregation() {
        ScoringInputs inputs = ScoringInputs.from(SampleSky.evening().build());

        assertEquals(10.0, inputs.cloudCoverPercent());
        assertEquals(0.55, inputs.moonIllumination());
        assertTrue(inputs.moonUp());
        assertEquals(4.33, inputs.kpIndex());
        assertEquals(TwilightPhase.NIGHT, inputs.darkness());

        ViewingConditionsScore score = scorer.score(inputs).orElseThrow();
        assertEquals(69, score.value());
        assertEquals(List.of("Moon is up - deep sky objects may be washed out"), score.recommendations());
    }

    @Test
    void unavailableDomainsBecomeAbsentFactors() {
        ScoringInputs inputs = ScoringInputs.from(SampleSky.evening()
                .unavailable(Domain.WEATHER, FailureReason.TIMEOUT)
                .unavailable(Domain.SUN, FailureReason.MALFORMED_PAYLOAD)
                .build());

        assertNull(inputs.cloudCoverPercent());
        assertNull(inputs.darkness());
        assertNotNull(inputs.moonIllumination());
        assertEquals(1.0, ViewingConditionsScorer.darknessMultiplier(inputs.darkness()));
    }
}
