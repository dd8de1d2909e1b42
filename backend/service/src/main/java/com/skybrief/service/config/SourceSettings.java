package com.skybrief.service.config;

import java.net.URI;
import java.time.Duration;

public record SourceSettings(Boolean liveEnabled, Duration timeout, URI endpoint, String apiKey) {
    public static final SourceSettings DEFAULT = new SourceSettings(true, null, null, null);

    public SourceSettings {
        liveEnabled = liveEnabled == null ? Boolean.TRUE : liveEnabled;
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
    }

    public SourceSettings withLiveEnabled(boolean enabled) {
        return new SourceSettings(enabled, timeout, endpoint, apiKey);
    }

    public SourceSettings withApiKey(String key) {
        return new SourceSettings(liveEnabled, timeout, endpoint, key);
    }

    @Override
    public String toString() {
        return "SourceSettings[liveEnabled=" + liveEnabled + ", timeout=" + timeout + ", endpoint=" + endpoint
                + ", apiKey=" + (apiKey == null ? "none" : "***") + "]";
    }
}
