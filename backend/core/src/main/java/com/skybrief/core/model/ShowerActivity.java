package com.skybrief.core.model;

import java.time.LocalDate;
import java.util.Objects;

public record ShowerActivity(MeteorShower shower, LocalDate peakDate, boolean active, long daysUntilPeak) {
    public ShowerActivity {
        Objects.requireNonNull(shower, "shower is required");
        Objects.requireNonNull(peakDate, "peakDate is required");
    }

    // Effective rate falls away from the peak night.
    public String viewingRating() {
        long daysOff = Math.abs(daysUntilPeak);
        double factor;
        if (daysOff == 0) {
            factor = 1.0;
        } else if (daysOff <= 2) {
            factor = 0.7;
        } else if (daysOff <= 5) {
            factor = 0.4;
        } else {
            factor = 0.2;
        }
        double effective = shower.zenithalHourlyRate() * factor;
        if (effective >= 80) {
            return "Excellent";
        }
        if (effective >= 40) {
            return "Good";
        }
        if (effective >= 15) {
            return "Fair";
        }
        return "Poor";
    }

    public boolean peaksTonight() {
        return daysUntilPeak == 0;
    }
}
