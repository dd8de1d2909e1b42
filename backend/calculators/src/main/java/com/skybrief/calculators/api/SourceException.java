package com.skybrief.calculators.api;

import com.skybrief.core.model.FailureReason;

import java.util.Objects;

public class SourceException extends Exception {
    private final FailureReason reason;

    public SourceException(FailureReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason is required");
    }

    public SourceException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason is required");
    }

    public FailureReason reason() {
        return reason;
    }

    public static SourceException malformed(String message) {
        return new SourceException(FailureReason.MALFORMED_PAYLOAD, message);
    }
}
