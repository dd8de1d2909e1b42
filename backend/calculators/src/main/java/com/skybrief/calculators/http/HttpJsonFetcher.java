package com.skybrief.calculators.http;

import com.skybrief.calculators.api.JsonFetcher;
import com.skybrief.calculators.api.JsonResponse;
import com.skybrief.calculators.api.SourceException;
import com.skybrief.core.model.FailureReason;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

public final class HttpJsonFetcher implements JsonFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpJsonFetcher.class.getName());
    public static final String DEFAULT_USER_AGENT = "skybrief/0.1";
    private static final int MAX_ATTEMPTS = 2;

    private final HttpClient httpClient;
    private final String userAgent;

    public HttpJsonFetcher(HttpClient httpClient, String userAgent) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent is required");
    }

    public static HttpJsonFetcher create(Duration connectTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new HttpJsonFetcher(client, DEFAULT_USER_AGENT);
    }

    // One reissue on a transient network error or 5xx; timeouts are final.
    @Override
    public JsonResponse fetchJson(URI uri, Duration timeout) throws SourceException {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("User-Agent", userAgent)
                    .build();
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() >= 500 && attempts < MAX_ATTEMPTS) {
                    LOGGER.fine(() -> "Retrying " + uri + " after status " + response.statusCode());
                    continue;
                }
                return new JsonResponse(uri, response.statusCode(), response.body());
            } catch (HttpTimeoutException e) {
                throw new SourceException(FailureReason.TIMEOUT, "Request to " + uri + " timed out after " + timeout.toMillis() + " ms", e);
            } catch (IOException e) {
                if (attempts >= MAX_ATTEMPTS) {
                    throw new SourceException(FailureReason.NETWORK_ERROR, "Request to " + uri + " failed: " + e.getMessage(), e);
                }
                LOGGER.fine(() -> "Retrying " + uri + " after " + e.getClass().getSimpleName());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceException(FailureReason.NETWORK_ERROR, "Request to " + uri + " interrupted", e);
            }
        }
    }
}
