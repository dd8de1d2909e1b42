package com.skybrief.core.model;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public record MeteorShower(
        String name,
        MonthDay start,
        MonthDay peak,
        MonthDay end,
        int zenithalHourlyRate,
        String radiant,
        String parentBody,
        Integer speedKmPerSecond
) {
    public MeteorShower {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(peak, "peak is required");
        Objects.requireNonNull(end, "end is required");
        if (zenithalHourlyRate < 0) {
            throw new IllegalArgumentException("zenithalHourlyRate must be >= 0 for " + name);
        }
    }

    public boolean wrapsYearEnd() {
        return end.isBefore(start);
    }

    public boolean isActive(LocalDate date) {
        MonthDay day = MonthDay.from(date);
        if (wrapsYearEnd()) {
            return !day.isBefore(start) || !day.isAfter(end);
        }
        return !day.isBefore(start) && !day.isAfter(end);
    }

    public LocalDate nearestPeak(LocalDate date) {
        LocalDate best = peak.atYear(date.getYear());
        for (int offset : new int[]{-1, 1}) {
            LocalDate candidate = peak.atYear(date.getYear() + offset);
            if (Math.abs(ChronoUnit.DAYS.between(date, candidate)) < Math.abs(ChronoUnit.DAYS.between(date, best))) {
                best = candidate;
            }
        }
        return best;
    }

    public LocalDate nextPeak(LocalDate date) {
        LocalDate candidate = peak.atYear(date.getYear());
        return candidate.isBefore(date) ? peak.atYear(date.getYear() + 1) : candidate;
    }
}
