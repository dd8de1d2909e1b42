package com.skybrief.core.model;

import java.util.List;

public record MeteorOutlook(List<ShowerActivity> active, List<ShowerActivity> upcoming) {
    public MeteorOutlook {
        active = List.copyOf(active);
        upcoming = List.copyOf(upcoming);
    }

    public boolean hasActiveShower() {
        return !active.isEmpty();
    }
}
