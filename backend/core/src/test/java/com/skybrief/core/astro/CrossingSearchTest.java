package com.skybrief.core.astro;

import com.skybrief.core.model.HorizonEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.function.ToDoubleFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrossingSearchTest {
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant END = START.plus(Duration.ofDays(1));

    // Peaks at 12:00 with amplitude 10, crossing zero at 06:00 and 18:00.
    private static final ToDoubleFunction<Instant> WAVE = t -> {
        double hours = Duration.between(START, t).toMillis() / 3_600_000.0;
        return -10.0 * Math.cos(hours / 24.0 * 2 * Math.PI);
    };

    @Test
    void bisectConvergesWithinAMinute() {
        HorizonEvent rise = CrossingSearch.bisect(WAVE, START, START.plus(Duration.ofHours(12)), 0.0);

        assertTrue(rise.occurs());
        long errorSeconds = Math.abs(Duration.between(START.plus(Duration.ofHours(6)), rise.time()).toSeconds());
        assertTrue(errorSeconds < 60, "error was " + errorSeconds + "s");
    }

    @Test
    void bisectReportsSteadyStateWhenNoCrossing() {
        assertEquals(HorizonEvent.Kind.ALWAYS_BELOW, CrossingSearch.bisect(WAVE, START, END, 20.0).kind());
        assertEquals(HorizonEvent.Kind.ALWAYS_ABOVE, CrossingSearch.bisect(WAVE, START, END, -20.0).kind());
    }

    @Test
    void scanFindsRiseAndSetInWindow() {
        RiseSet riseSet = CrossingSearch.scan(WAVE, START, END, Duration.ofMinutes(10), 0.0);

        assertTrue(riseSet.rise().occurs());
        assertTrue(riseSet.set().occurs());
        assertTrue(Math.abs(Duration.between(START.plus(Duration.ofHours(6)), riseSet.rise().time()).toSeconds()) < 60);
        assertTrue(Math.abs(Duration.between(START.plus(Duration.ofHours(18)), riseSet.set().time()).toSeconds()) < 60);
    }

    @Test
    void scanMarksMissingCrossingAsNotInWindow() {
        RiseSet riseSet = CrossingSearch.scan(WAVE, START, START.plus(Duration.ofHours(12)), Duration.ofMinutes(10), 0.0);

        assertTrue(riseSet.rise().occurs());
        assertEquals(HorizonEvent.Kind.NOT_IN_WINDOW, riseSet.set().kind());
    }

    @Test
    void scanWithoutAnyCrossingReportsSteadyState() {
        RiseSet above = CrossingSearch.scan(WAVE, START, END, Duration.ofMinutes(10), -11.0);
        RiseSet below = CrossingSearch.scan(WAVE, START, END, Duration.ofMinutes(10), 11.0);

        assertEquals(HorizonEvent.Kind.ALWAYS_ABOVE, above.rise().kind());
        assertEquals(HorizonEvent.Kind.ALWAYS_ABOVE, above.set().kind());
        assertEquals(HorizonEvent.Kind.ALWAYS_BELOW, below.rise().kind());
        assertEquals(HorizonEvent.Kind.ALWAYS_BELOW, below.set().kind());
    }

    @Test
    void scanRejectsNonPositiveStep() {
        assertThrows(IllegalArgumentException.class,
                () -> CrossingSearch.scan(WAVE, START, END, Duration.ZERO, 0.0));
    }
}
