package com.skybrief.service.config;

import com.skybrief.core.model.Domain;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-domain source settings keyed by {@link Domain#key()}. A domain timeout bounds the whole live
 * attempt; the request timeout bounds each HTTP call inside it.
 */
public record EngineConfig(
        Duration requestTimeout,
        Duration domainTimeout,
        Integer workerThreads,
        Map<String, SourceSettings> sources
) {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(4);
    public static final Duration DEFAULT_DOMAIN_TIMEOUT = Duration.ofSeconds(8);
    public static final int DEFAULT_WORKER_THREADS = Domain.values().length + 1;

    private static final Set<String> KNOWN_KEYS = Arrays.stream(Domain.values())
            .map(Domain::key)
            .collect(Collectors.toUnmodifiableSet());

    public EngineConfig {
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
        domainTimeout = domainTimeout == null ? DEFAULT_DOMAIN_TIMEOUT : domainTimeout;
        workerThreads = workerThreads == null ? DEFAULT_WORKER_THREADS : workerThreads;
        sources = sources == null ? Map.of() : Map.copyOf(sources);
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
        if (domainTimeout.isZero() || domainTimeout.isNegative()) {
            throw new IllegalArgumentException("domainTimeout must be positive: " + domainTimeout);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1: " + workerThreads);
        }
        for (String key : sources.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown source '" + key + "', expected one of " + KNOWN_KEYS);
            }
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null);
    }

    public SourceSettings settingsFor(Domain domain) {
        return sources.getOrDefault(domain.key(), SourceSettings.DEFAULT);
    }

    public boolean liveEnabled(Domain domain) {
        return settingsFor(domain).liveEnabled();
    }

    public Duration timeoutFor(Domain domain) {
        Duration timeout = settingsFor(domain).timeout();
        return timeout == null ? domainTimeout : timeout;
    }

    public Duration requestTimeoutFor(Domain domain) {
        Duration domainLimit = timeoutFor(domain);
        return domainLimit.compareTo(requestTimeout) < 0 ? domainLimit : requestTimeout;
    }

    public Optional<URI> endpointFor(Domain domain) {
        return Optional.ofNullable(settingsFor(domain).endpoint());
    }

    public Optional<String> apiKeyFor(Domain domain) {
        return Optional.ofNullable(settingsFor(domain).apiKey());
    }

    public EngineConfig withApiKey(Domain domain, String apiKey) {
        Map<String, SourceSettings> updated = new LinkedHashMap<>(sources);
        updated.put(domain.key(), settingsFor(domain).withApiKey(apiKey));
        return new EngineConfig(requestTimeout, domainTimeout, workerThreads, updated);
    }

    public EngineConfig offline() {
        Map<String, SourceSettings> disabled = new LinkedHashMap<>();
        for (Domain domain : Domain.values()) {
            disabled.put(domain.key(), settingsFor(domain).withLiveEnabled(false));
        }
        return new EngineConfig(requestTimeout, domainTimeout, workerThreads, disabled);
    }
}
