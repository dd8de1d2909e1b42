package com.skybrief.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One domain's answer for an aggregation run. UNAVAILABLE never carries a value; LOCAL_FALLBACK
 * records why the live source was not used ({@link FailureReason#NONE} when there is none).
 */
public record SourceResult<T>(Provenance provenance, T value, FailureReason reason, String detail) {
    public SourceResult {
        Objects.requireNonNull(provenance, "provenance is required");
        Objects.requireNonNull(reason, "reason is required");
        switch (provenance) {
            case LIVE -> {
                Objects.requireNonNull(value, "LIVE result requires a value");
                if (reason != FailureReason.NONE) {
                    throw new IllegalArgumentException("LIVE result cannot carry failure reason " + reason);
                }
            }
            case LOCAL_FALLBACK -> Objects.requireNonNull(value, "LOCAL_FALLBACK result requires a value");
            case UNAVAILABLE -> {
                if (value != null) {
                    throw new IllegalArgumentException("UNAVAILABLE result cannot carry a value");
                }
                if (reason == FailureReason.NONE) {
                    throw new IllegalArgumentException("UNAVAILABLE result requires a reason");
                }
            }
        }
    }

    public static <T> SourceResult<T> live(T value) {
        return new SourceResult<>(Provenance.LIVE, value, FailureReason.NONE, null);
    }

    public static <T> SourceResult<T> fallback(T value, FailureReason cause, String detail) {
        return new SourceResult<>(Provenance.LOCAL_FALLBACK, value, cause, detail);
    }

    public static <T> SourceResult<T> local(T value) {
        return fallback(value, FailureReason.NONE, null);
    }

    public static <T> SourceResult<T> unavailable(FailureReason reason, String detail) {
        return new SourceResult<>(Provenance.UNAVAILABLE, null, reason, detail);
    }

    public boolean isAvailable() {
        return provenance != Provenance.UNAVAILABLE;
    }

    public Optional<T> optionalValue() {
        return Optional.ofNullable(value);
    }
}
