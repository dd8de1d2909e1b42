package com.skybrief.service.scoring;

import com.skybrief.core.model.FactorContribution;
import com.skybrief.core.model.ScoreCategory;
import com.skybrief.core.model.ScoreFactor;
import com.skybrief.core.model.TwilightPhase;
import com.skybrief.core.model.ViewingConditionsScore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weighted factor score. Weights of absent factors are dropped and the rest rescaled linearly so they
 * sum to one; the darkness multiplier is folded into each contribution so the breakdown adds up to
 * the total.
 */
public class ViewingConditionsScorer {
    static final double MOON_EXPONENT = 0.7;

    private static final Map<TwilightPhase, Double> DARKNESS_MULTIPLIERS = new EnumMap<>(Map.of(
            TwilightPhase.NIGHT, 1.0,
            TwilightPhase.ASTRONOMICAL, 0.9,
            TwilightPhase.NAUTICAL, 0.75,
            TwilightPhase.CIVIL, 0.5,
            TwilightPhase.DAY, 0.25
    ));

    public Optional<ViewingConditionsScore> score(ScoringInputs inputs) {
        Map<ScoreFactor, Double> subScores = new EnumMap<>(ScoreFactor.class);
        if (inputs.cloudCoverPercent() != null) {
            subScores.put(ScoreFactor.CLOUD_COVER, 100.0 - clamp(inputs.cloudCoverPercent()));
        }
        if (inputs.moonIllumination() != null) {
            subScores.put(ScoreFactor.MOON, moonSubScore(inputs.moonIllumination(), !Boolean.FALSE.equals(inputs.moonUp())));
        }
        if (inputs.kpIndex() != null) {
            subScores.put(ScoreFactor.GEOMAGNETIC, Math.min(100.0, 40.0 + 10.0 * inputs.kpIndex()));
        }
        if (subScores.isEmpty()) {
            return Optional.empty();
        }

        double multiplier = darknessMultiplier(inputs.darkness());
        int totalWeight = subScores.keySet().stream().mapToInt(ScoreFactor::weight).sum();
        List<FactorContribution> breakdown = new ArrayList<>();
        double raw = 0;
        for (Map.Entry<ScoreFactor, Double> entry : subScores.entrySet()) {
            ScoreFactor factor = entry.getKey();
            double normalized = (double) factor.weight() / totalWeight;
            double contribution = entry.getValue() * normalized * multiplier;
            raw += contribution;
            breakdown.add(new FactorContribution(factor, entry.getValue(), factor.weight(), normalized, contribution));
        }
        int value = (int) Math.max(0, Math.min(100, Math.round(raw)));
        return Optional.of(new ViewingConditionsScore(
                value,
                ScoreCategory.fromScore(value),
                breakdown,
                inputs.darkness(),
                multiplier,
                recommendations(inputs)
        ));
    }

    static double moonSubScore(double illumination, boolean up) {
        if (!up) {
            return 100.0;
        }
        return 100.0 * (1.0 - Math.pow(Math.max(0.0, Math.min(1.0, illumination)), MOON_EXPONENT));
    }

    // Unknown darkness does not penalise the score.
    static double darknessMultiplier(TwilightPhase phase) {
        return phase == null ? 1.0 : DARKNESS_MULTIPLIERS.get(phase);
    }

    static List<String> recommendations(ScoringInputs inputs) {
        List<String> tips = new ArrayList<>();
        Double cloud = inputs.cloudCoverPercent();
        if (cloud != null) {
            if (cloud > 75) {
                tips.add("Heavy cloud cover - wait for clearer skies");
            } else if (cloud > 50) {
                tips.add("Significant clouds - viewing may be intermittent");
            } else if (cloud > 25) {
                tips.add("Some clouds - find gaps for observing");
            }
        }
        Double illumination = inputs.moonIllumination();
        boolean moonUp = !Boolean.FALSE.equals(inputs.moonUp());
        if (illumination != null) {
            if (illumination > 0.8 && moonUp) {
                tips.add("Bright moon - best for planets and the Moon itself");
            } else if (illumination > 0.5 && moonUp) {
                tips.add("Moon is up - deep sky objects may be washed out");
            } else if (illumination < 0.2) {
                tips.add("Dark moon - great for galaxies and nebulae");
            }
        }
        if (inputs.darkness() != null && inputs.darkness() != TwilightPhase.NIGHT) {
            tips.add("Not fully dark - brighter objects only");
        }
        if (cloud != null && cloud < 20 && illumination != null && illumination < 0.3) {
            tips.add("Excellent for deep sky observing!");
        }
        return tips;
    }

    private static double clamp(double percent) {
        return Math.max(0.0, Math.min(100.0, percent));
    }
}
