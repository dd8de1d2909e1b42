package com.skybrief.core.model;

public enum FailureReason {
    NONE,
    TIMEOUT,
    NETWORK_ERROR,
    HTTP_STATUS,
    MALFORMED_PAYLOAD,
    STALE_DATA,
    DISABLED,
    NO_FALLBACK,
    COMPUTATION_FAILED
}
