package com.skybrief.calculators.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.core.model.FailureReason;
import com.skybrief.core.util.JsonUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

public final class LivePayloads {
    private LivePayloads() {
    }

    public static JsonNode fetchTree(CalculationContext ctx, URI uri) throws SourceException {
        JsonResponse response = ctx.fetcher().fetchJson(uri, ctx.requestTimeout());
        if (!response.isSuccess()) {
            throw new SourceException(FailureReason.HTTP_STATUS, "Request failed with status " + response.status() + " for " + uri);
        }
        return parse(response);
    }

    public static JsonNode parse(JsonResponse response) throws SourceException {
        if (response.body().isBlank()) {
            throw SourceException.malformed("Empty body from " + response.uri());
        }
        try {
            return JsonUtils.objectMapper().readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new SourceException(FailureReason.MALFORMED_PAYLOAD, "Invalid JSON from " + response.uri(), e);
        }
    }

    public static JsonNode requiredNode(JsonNode parent, String field) throws SourceException {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            throw SourceException.malformed("Missing field '" + field + "'");
        }
        return node;
    }

    public static String requiredText(JsonNode parent, String field) throws SourceException {
        String text = requiredNode(parent, field).asText("");
        if (text.isBlank()) {
            throw SourceException.malformed("Blank field '" + field + "'");
        }
        return text;
    }

    public static double requiredDouble(JsonNode parent, String field) throws SourceException {
        Double value = optionalDouble(parent, field);
        if (value == null) {
            throw SourceException.malformed("Missing numeric field '" + field + "'");
        }
        return value;
    }

    // Accepts JSON numbers and numeric strings; anything else is treated as absent.
    public static Double optionalDouble(JsonNode parent, String field) throws SourceException {
        JsonNode node = parent.path(field);
        return toDouble(node, field);
    }

    public static Double toDouble(JsonNode node, String label) throws SourceException {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return checkFinite(node.asDouble(), label);
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return checkFinite(Double.parseDouble(text), label);
            } catch (NumberFormatException e) {
                throw new SourceException(FailureReason.MALFORMED_PAYLOAD, "Non-numeric value for '" + label + "': " + text, e);
            }
        }
        throw SourceException.malformed("Non-numeric value for '" + label + "'");
    }

    public static double inRange(double value, double min, double max, String label) throws SourceException {
        if (value < min || value > max) {
            throw SourceException.malformed("Value for '" + label + "' out of range [" + min + ", " + max + "]: " + value);
        }
        return value;
    }

    public static URI withQuery(URI endpoint, String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Query parameters must come in key/value pairs");
        }
        StringJoiner query = new StringJoiner("&");
        for (int i = 0; i < keysAndValues.length; i += 2) {
            query.add(encode(keysAndValues[i]) + "=" + encode(keysAndValues[i + 1]));
        }
        String base = endpoint.toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static double checkFinite(double value, String label) throws SourceException {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw SourceException.malformed("Non-finite value for '" + label + "'");
        }
        return value;
    }
}
