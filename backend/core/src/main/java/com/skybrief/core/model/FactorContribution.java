package com.skybrief.core.model;

import java.util.Objects;

public record FactorContribution(
        ScoreFactor factor,
        double subScore,
        int weight,
        double normalizedWeight,
        double contribution
) {
    public FactorContribution {
        Objects.requireNonNull(factor, "factor is required");
        if (subScore < 0 || subScore > 100) {
            throw new IllegalArgumentException(factor + " sub-score must be within [0, 100]: " + subScore);
        }
    }
}
