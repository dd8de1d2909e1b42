package com.skybrief.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public record EclipseOutlook(EclipseEvent today, List<EclipseEvent> upcoming, int horizonDays, LocalDate coveredThrough) {
    public EclipseOutlook {
        upcoming = List.copyOf(upcoming);
    }

    public Optional<EclipseEvent> eclipseToday() {
        return Optional.ofNullable(today);
    }

    public Optional<EclipseEvent> next() {
        return upcoming.stream().findFirst();
    }
}
