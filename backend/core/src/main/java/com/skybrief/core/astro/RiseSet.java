package com.skybrief.core.astro;

import com.skybrief.core.model.HorizonEvent;

import java.util.Objects;

public record RiseSet(HorizonEvent rise, HorizonEvent set) {
    public RiseSet {
        Objects.requireNonNull(rise, "rise is required");
        Objects.requireNonNull(set, "set is required");
    }
}
