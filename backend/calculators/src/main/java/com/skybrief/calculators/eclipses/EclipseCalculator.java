package com.skybrief.calculators.eclipses;

import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.core.calendar.CelestialCalendar;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.EclipseOutlook;

import java.time.LocalDate;
import java.util.Objects;

public class EclipseCalculator implements Calculator<EclipseOutlook> {
    public static final int DEFAULT_HORIZON_DAYS = 365;

    private final CelestialCalendar calendar;
    private final int horizonDays;

    public EclipseCalculator(CelestialCalendar calendar) {
        this(calendar, DEFAULT_HORIZON_DAYS);
    }

    public EclipseCalculator(CelestialCalendar calendar, int horizonDays) {
        this.calendar = Objects.requireNonNull(calendar, "calendar is required");
        if (horizonDays < 0) {
            throw new IllegalArgumentException("horizonDays must be >= 0");
        }
        this.horizonDays = horizonDays;
    }

    @Override
    public Domain domain() {
        return Domain.ECLIPSES;
    }

    @Override
    public boolean hasLiveSource() {
        return false;
    }

    @Override
    public boolean hasLocalFallback() {
        return true;
    }

    @Override
    public EclipseOutlook computeLive(CalculationContext ctx) {
        throw new UnsupportedOperationException("Eclipses have no live source");
    }

    // Dates past the table yield an empty list; coveredThrough tells the reader why.
    @Override
    public EclipseOutlook computeLocal(CalculationContext ctx) {
        LocalDate date = ctx.localDate();
        return new EclipseOutlook(
                calendar.eclipseOn(date).orElse(null),
                calendar.upcomingEclipses(date, horizonDays),
                horizonDays,
                calendar.eclipseCoverageEnd().orElse(null)
        );
    }
}
