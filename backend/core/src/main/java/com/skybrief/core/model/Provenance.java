package com.skybrief.core.model;

public enum Provenance {
    LIVE,
    LOCAL_FALLBACK,
    UNAVAILABLE
}
