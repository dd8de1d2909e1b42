package com.skybrief.core.astro;

import com.skybrief.core.model.HorizonEvent;
import com.skybrief.core.model.MoonPhase;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LunarMathTest {
    private static final long SYNODIC_MONTH_MILLIS = Math.round(LunarMath.SYNODIC_MONTH_DAYS * 86_400_000L);

    @Test
    void referenceEpochIsNewMoonWithNoIllumination() {
        double angle = LunarMath.phaseAngle(LunarMath.REFERENCE_NEW_MOON);

        assertEquals(MoonPhase.NEW, LunarMath.phaseFor(angle));
        assertEquals(0.0, LunarMath.illumination(angle), 1e-9);
        assertEquals(0.0, LunarMath.ageDays(LunarMath.REFERENCE_NEW_MOON), 1e-9);
    }

    @Test
    void knownFullMoonIsBucketedFull() {
        double angle = LunarMath.phaseAngle(Instant.parse("2024-01-25T17:54:00Z"));

        assertEquals(MoonPhase.FULL, LunarMath.phaseFor(angle));
        assertTrue(LunarMath.illumination(angle) > 0.99);
    }

    @Test
    void knownFirstQuarterIsBucketedFirstQuarter() {
        double angle = LunarMath.phaseAngle(Instant.parse("2026-10-19T00:00:00Z"));

        assertEquals(MoonPhase.FIRST_QUARTER, LunarMath.phaseFor(angle));
        assertEquals(0.52, LunarMath.illumination(angle), 0.05);
    }

    @Test
    void bucketsAreCentredOnPrincipalPhases() {
        assertEquals(MoonPhase.NEW, LunarMath.phaseFor(359.0));
        assertEquals(MoonPhase.NEW, LunarMath.phaseFor(22.4));
        assertEquals(MoonPhase.WAXING_CRESCENT, LunarMath.phaseFor(22.6));
        assertEquals(MoonPhase.FIRST_QUARTER, LunarMath.phaseFor(90.0));
        assertEquals(MoonPhase.FULL, LunarMath.phaseFor(180.0));
        assertEquals(MoonPhase.FULL, LunarMath.phaseFor(180.0 + 360.0));
        assertEquals(MoonPhase.LAST_QUARTER, LunarMath.phaseFor(270.0));
        assertEquals(MoonPhase.WANING_CRESCENT, LunarMath.phaseFor(-30.0));
    }

    @Test
    void phaseIsStableUnderWholeSynodicMonths() {
        Instant base = Instant.parse("2026-10-19T21:00:00Z");
        MoonPhase expected = LunarMath.phaseFor(LunarMath.phaseAngle(base));
        double expectedIllumination = LunarMath.illumination(LunarMath.phaseAngle(base));

        for (int months = -24; months <= 24; months += 6) {
            Instant shifted = base.plusMillis(months * SYNODIC_MONTH_MILLIS);
            double angle = LunarMath.phaseAngle(shifted);
            assertEquals(expected, LunarMath.phaseFor(angle), "months=" + months);
            assertEquals(expectedIllumination, LunarMath.illumination(angle), 1e-6);
        }
    }

    @Test
    void illuminationStaysWithinUnitInterval() {
        Instant cursor = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 400; i++) {
            double illumination = LunarMath.illumination(LunarMath.phaseAngle(cursor));
            assertTrue(illumination >= 0.0 && illumination <= 1.0);
            cursor = cursor.plus(Duration.ofHours(7));
        }
    }

    @Test
    void nextPhaseSearchLandsOnFollowingNewAndFullMoon() {
        Instant reference = LunarMath.REFERENCE_NEW_MOON;

        Instant nextNew = LunarMath.nextNewMoon(reference);
        Instant nextFull = LunarMath.nextFullMoon(reference);

        assertEquals(SYNODIC_MONTH_MILLIS, Duration.between(reference, nextNew).toMillis(), 1_000);
        assertEquals(SYNODIC_MONTH_MILLIS / 2, Duration.between(reference, nextFull).toMillis(), 1_000);
        assertTrue(LunarMath.illumination(LunarMath.phaseAngle(nextFull)) > 0.999);
    }

    @Test
    void moonRiseAndSetForNewYorkMatchAlmanacWithinTolerance() {
        Instant localMidnight = Instant.parse("2024-01-25T05:00:00Z");

        RiseSet riseSet = LunarMath.riseAndSet(40.7, -74.0, localMidnight, localMidnight.plus(Duration.ofDays(1)));

        assertTrue(riseSet.set().occurs());
        assertTrue(riseSet.rise().occurs());
        assertWithin(Instant.parse("2024-01-25T12:45:00Z"), riseSet.set().time(), Duration.ofMinutes(20));
        assertWithin(Instant.parse("2024-01-25T22:08:00Z"), riseSet.rise().time(), Duration.ofMinutes(20));
    }

    @Test
    void circumpolarMoonReportsSteadyStateInsteadOfLooping() {
        Instant start = Instant.parse("2026-06-01T00:00:00Z");
        boolean sawSteadyState = false;
        for (int day = 0; day < 30; day++) {
            Instant windowStart = start.plus(Duration.ofDays(day));
            RiseSet riseSet = LunarMath.riseAndSet(80.0, 0.0, windowStart, windowStart.plus(Duration.ofDays(1)));
            HorizonEvent.Kind kind = riseSet.rise().kind();
            if (kind == HorizonEvent.Kind.ALWAYS_ABOVE || kind == HorizonEvent.Kind.ALWAYS_BELOW) {
                sawSteadyState = true;
            }
        }
        assertTrue(sawSteadyState);
    }

    private static void assertWithin(Instant expected, Instant actual, Duration tolerance) {
        Duration error = Duration.between(expected, actual).abs();
        assertTrue(error.compareTo(tolerance) <= 0, "expected " + expected + " but was " + actual);
    }
}
