package com.skybrief.core.model;

import java.util.List;
import java.util.Objects;

public record ViewingConditionsScore(
        int value,
        ScoreCategory category,
        List<FactorContribution> breakdown,
        TwilightPhase darkness,
        double darknessMultiplier,
        List<String> recommendations
) {
    public ViewingConditionsScore {
        Objects.requireNonNull(category, "category is required");
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException("score must be within [0, 100]: " + value);
        }
        if (category != ScoreCategory.fromScore(value)) {
            throw new IllegalArgumentException("category " + category + " does not match score " + value);
        }
        breakdown = List.copyOf(breakdown);
        recommendations = List.copyOf(recommendations);
    }

    public double breakdownTotal() {
        return breakdown.stream().mapToDouble(FactorContribution::contribution).sum();
    }
}
