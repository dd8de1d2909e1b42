package com.skybrief.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

public record EclipseEvent(
        EclipseKind kind,
        LocalDate date,
        Instant maximum,
        Double durationMinutes,
        List<String> regions,
        Double magnitude,
        String notes
) {
    public EclipseEvent {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(maximum, "maximum is required");
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public boolean isUpcoming(LocalDate from, int horizonDays) {
        if (horizonDays < 0) {
            throw new IllegalArgumentException("horizonDays must be >= 0");
        }
        return !date.isBefore(from) && !date.isAfter(from.plusDays(horizonDays));
    }
}
