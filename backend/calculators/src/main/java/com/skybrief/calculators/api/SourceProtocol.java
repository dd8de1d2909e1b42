package com.skybrief.calculators.api;

import com.skybrief.core.model.FailureReason;
import com.skybrief.core.model.SourceResult;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Live-then-local resolution shared by single-domain calls and the orchestrator.
 */
public final class SourceProtocol {
    private static final Logger LOGGER = Logger.getLogger(SourceProtocol.class.getName());

    private SourceProtocol() {
    }

    public static <T> SourceResult<T> resolve(Calculator<T> calculator, CalculationContext ctx, boolean liveEnabled) {
        if (!calculator.hasLiveSource()) {
            return fallback(calculator, ctx, FailureReason.NONE, null);
        }
        if (!liveEnabled) {
            return fallback(calculator, ctx, FailureReason.DISABLED, "Live source disabled by configuration");
        }
        try {
            return SourceResult.live(attemptLive(calculator, ctx));
        } catch (SourceException e) {
            return fallback(calculator, ctx, e.reason(), e.getMessage());
        }
    }

    // Unexpected runtime failures while reading a payload are soft failures, never crashes.
    public static <T> T attemptLive(Calculator<T> calculator, CalculationContext ctx) throws SourceException {
        try {
            return calculator.computeLive(ctx);
        } catch (RuntimeException e) {
            throw new SourceException(FailureReason.MALFORMED_PAYLOAD,
                    calculator.domain().key() + " payload rejected: " + rootMessage(e), e);
        }
    }

    public static <T> SourceResult<T> fallback(
            Calculator<T> calculator,
            CalculationContext ctx,
            FailureReason cause,
            String detail
    ) {
        if (cause != FailureReason.NONE) {
            LOGGER.warning(() -> "Live " + calculator.domain().key() + " source failed (" + cause + "): " + detail);
        }
        if (!calculator.hasLocalFallback()) {
            FailureReason reason = cause == FailureReason.NONE ? FailureReason.NO_FALLBACK : cause;
            return SourceResult.unavailable(reason, detail == null ? "No local source for " + calculator.domain().key() : detail);
        }
        try {
            return SourceResult.fallback(calculator.computeLocal(ctx), cause, detail);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Local " + calculator.domain().key() + " computation failed", e);
            return SourceResult.unavailable(FailureReason.COMPUTATION_FAILED, rootMessage(e));
        }
    }

    public static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
