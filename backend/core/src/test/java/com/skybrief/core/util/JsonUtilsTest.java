package com.skybrief.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.MonthDay;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndKeepsExplicitNulls() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertSame(mapper, JsonUtils.objectMapper());
        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        JsonNode tree = mapper.readTree(mapper.writeValueAsString(
                new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"), MonthDay.of(12, 14))));
        assertEquals("ok", tree.get("name").asText());
        assertTrue(tree.get("optional").isNull());
        assertEquals("2026-02-01T00:00:00Z", tree.get("createdAt").asText());
        assertEquals("--12-14", tree.get("peak").asText());
    }

    @Test
    void readsClasspathResourcesAndIgnoresUnknownFields() {
        List<Payload> payloads = JsonUtils.readResource(getClass().getClassLoader(), "json/payloads.json",
                new TypeReference<>() {
                });

        assertEquals(1, payloads.size());
        assertEquals(MonthDay.of(1, 4), payloads.get(0).peak());
        assertEquals(Instant.parse("2026-01-04T02:00:00Z"), payloads.get(0).createdAt());
    }

    @Test
    void missingResourceIsReportedByName() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> JsonUtils.readResource(getClass().getClassLoader(), "json/absent.json", new TypeReference<List<Payload>>() {
                }));

        assertTrue(error.getMessage().contains("json/absent.json"));
    }

    @Test
    void prettyJsonIsIndented() {
        String json = JsonUtils.toPrettyJson(new Payload("x", "y", null, null));

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"createdAt\" : null"));
    }

    private record Payload(String name, String optional, Instant createdAt, MonthDay peak) {
    }
}
