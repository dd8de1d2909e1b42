package com.skybrief.calculators.api;

import com.skybrief.core.model.Domain;
import com.skybrief.core.model.SourceResult;

public interface Calculator<T> {
    Domain domain();

    boolean hasLiveSource();

    boolean hasLocalFallback();

    T computeLive(CalculationContext ctx) throws SourceException;

    T computeLocal(CalculationContext ctx);

    default SourceResult<T> compute(CalculationContext ctx) {
        return SourceProtocol.resolve(this, ctx, true);
    }
}
