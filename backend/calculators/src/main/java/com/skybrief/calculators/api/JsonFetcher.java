package com.skybrief.calculators.api;

import java.net.URI;
import java.time.Duration;

@FunctionalInterface
public interface JsonFetcher {
    JsonResponse fetchJson(URI uri, Duration timeout) throws SourceException;
}
