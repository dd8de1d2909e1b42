package com.skybrief.calculators.api;

import java.net.URI;
import java.util.Objects;

public record JsonResponse(URI uri, int status, String body) {
    public JsonResponse {
        Objects.requireNonNull(uri, "uri is required");
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return status / 100 == 2;
    }
}
