package com.skybrief.calculators.meteors;

import com.skybrief.calculators.api.CalculationContext;
import com.skybrief.calculators.api.Calculator;
import com.skybrief.core.calendar.CelestialCalendar;
import com.skybrief.core.model.Domain;
import com.skybrief.core.model.MeteorOutlook;
import com.skybrief.core.model.MeteorShower;
import com.skybrief.core.model.ShowerActivity;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

public class MeteorShowerCalculator implements Calculator<MeteorOutlook> {
    public static final int DEFAULT_LOOKAHEAD_DAYS = 60;

    private final CelestialCalendar calendar;
    private final int lookaheadDays;

    public MeteorShowerCalculator(CelestialCalendar calendar) {
        this(calendar, DEFAULT_LOOKAHEAD_DAYS);
    }

    public MeteorShowerCalculator(CelestialCalendar calendar, int lookaheadDays) {
        this.calendar = Objects.requireNonNull(calendar, "calendar is required");
        if (lookaheadDays < 0) {
            throw new IllegalArgumentException("lookaheadDays must be >= 0");
        }
        this.lookaheadDays = lookaheadDays;
    }

    @Override
    public Domain domain() {
        return Domain.METEOR_SHOWERS;
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
    public MeteorOutlook computeLive(CalculationContext ctx) {
        throw new UnsupportedOperationException("Meteor showers have no live source");
    }

    @Override
    public MeteorOutlook computeLocal(CalculationContext ctx) {
        LocalDate date = ctx.localDate();
        List<ShowerActivity> active = calendar.activeShowers(date).stream()
                .map(shower -> activity(shower, shower.nearestPeak(date), true, date))
                .toList();
        List<ShowerActivity> upcoming = calendar.showersPeakingWithin(date, lookaheadDays).stream()
                .filter(shower -> !shower.isActive(date))
                .map(shower -> activity(shower, shower.nextPeak(date), false, date))
                .toList();
        return new MeteorOutlook(active, upcoming);
    }

    private static ShowerActivity activity(MeteorShower shower, LocalDate peak, boolean active, LocalDate date) {
        return new ShowerActivity(shower, peak, active, ChronoUnit.DAYS.between(date, peak));
    }
}
