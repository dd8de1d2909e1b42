package com.skybrief.core.astro;

import com.skybrief.core.model.HorizonEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.function.ToDoubleFunction;

public final class CrossingSearch {
    public static final int MAX_ITERATIONS = 24;

    private static final long TOLERANCE_MILLIS = 1_000;

    private CrossingSearch() {
    }

    /**
     * Finds the single crossing of {@code threshold} between {@code from} and {@code to}.
     * Endpoints on the same side report ALWAYS_ABOVE or ALWAYS_BELOW.
     */
    public static HorizonEvent bisect(ToDoubleFunction<Instant> altitude, Instant from, Instant to, double threshold) {
        double startValue = altitude.applyAsDouble(from) - threshold;
        double endValue = altitude.applyAsDouble(to) - threshold;
        if (startValue > 0 && endValue > 0) {
            return HorizonEvent.alwaysAbove();
        }
        if (startValue <= 0 && endValue <= 0) {
            return HorizonEvent.alwaysBelow();
        }
        return HorizonEvent.occurs(refine(altitude, from, to, threshold, startValue > 0));
    }

    /**
     * Samples the window at {@code step} and refines the first upward and first downward crossing.
     */
    public static RiseSet scan(
            ToDoubleFunction<Instant> altitude,
            Instant from,
            Instant to,
            Duration step,
            double threshold
    ) {
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive");
        }
        Instant previous = from;
        double previousValue = altitude.applyAsDouble(from) - threshold;
        boolean everAbove = previousValue > 0;
        boolean everBelow = previousValue <= 0;
        HorizonEvent rise = null;
        HorizonEvent set = null;

        while (previous.isBefore(to) && (rise == null || set == null)) {
            Instant next = previous.plus(step);
            if (next.isAfter(to)) {
                next = to;
            }
            double nextValue = altitude.applyAsDouble(next) - threshold;
            everAbove |= nextValue > 0;
            everBelow |= nextValue <= 0;
            if (rise == null && previousValue <= 0 && nextValue > 0) {
                rise = HorizonEvent.occurs(refine(altitude, previous, next, threshold, false));
            } else if (set == null && previousValue > 0 && nextValue <= 0) {
                set = HorizonEvent.occurs(refine(altitude, previous, next, threshold, true));
            }
            previous = next;
            previousValue = nextValue;
        }

        if (rise == null && set == null) {
            HorizonEvent steady = everAbove && !everBelow ? HorizonEvent.alwaysAbove() : HorizonEvent.alwaysBelow();
            return new RiseSet(steady, steady);
        }
        return new RiseSet(
                rise == null ? HorizonEvent.notInWindow() : rise,
                set == null ? HorizonEvent.notInWindow() : set
        );
    }

    private static Instant refine(
            ToDoubleFunction<Instant> altitude,
            Instant from,
            Instant to,
            double threshold,
            boolean startAbove
    ) {
        long low = from.toEpochMilli();
        long high = to.toEpochMilli();
        for (int i = 0; i < MAX_ITERATIONS && high - low > TOLERANCE_MILLIS; i++) {
            long mid = low + (high - low) / 2;
            boolean midAbove = altitude.applyAsDouble(Instant.ofEpochMilli(mid)) - threshold > 0;
            if (midAbove == startAbove) {
                low = mid;
            } else {
                high = mid;
            }
        }
        return Instant.ofEpochMilli(low + (high - low) / 2);
    }
}
