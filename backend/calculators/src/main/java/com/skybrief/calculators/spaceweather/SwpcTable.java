package com.skybrief.calculators.spaceweather;

import com.fasterxml.jackson.databind.JsonNode;
import com.skybrief.calculators.api.LivePayloads;
import com.skybrief.calculators.api.SourceException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * SWPC products come either as an array of arrays with a header row or as an array of objects.
 * Both are read into rows keyed by lower-case column name.
 */
final class SwpcTable {
    private final List<Map<String, JsonNode>> rows;

    private SwpcTable(List<Map<String, JsonNode>> rows) {
        this.rows = rows;
    }

    static SwpcTable parse(JsonNode root) throws SourceException {
        if (!root.isArray() || root.isEmpty()) {
            throw SourceException.malformed("Expected a non-empty JSON array");
        }
        List<Map<String, JsonNode>> rows = new ArrayList<>();
        if (root.get(0).isArray()) {
            List<String> header = new ArrayList<>();
            root.get(0).forEach(cell -> header.add(cell.asText("").toLowerCase(Locale.ROOT)));
            for (int i = 1; i < root.size(); i++) {
                JsonNode row = root.get(i);
                Map<String, JsonNode> values = new HashMap<>();
                for (int c = 0; c < header.size() && c < row.size(); c++) {
                    values.put(header.get(c), row.get(c));
                }
                rows.add(values);
            }
        } else if (root.get(0).isObject()) {
            for (JsonNode row : root) {
                Map<String, JsonNode> values = new HashMap<>();
                row.fields().forEachRemaining(entry -> values.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue()));
                rows.add(values);
            }
        } else {
            throw SourceException.malformed("Unrecognised table layout");
        }
        return new SwpcTable(rows);
    }

    List<Map<String, JsonNode>> rows() {
        return rows;
    }

    boolean isEmpty() {
        return rows.isEmpty();
    }

    static Instant time(Map<String, JsonNode> row) throws SourceException {
        JsonNode node = row.get("time_tag");
        if (node == null || node.isNull()) {
            throw SourceException.malformed("Row without time_tag");
        }
        String text = node.asText("").trim().replace(' ', 'T');
        if (text.endsWith("Z")) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw SourceException.malformed("Invalid time_tag '" + node.asText() + "'");
        }
    }

    static Double number(Map<String, JsonNode> row, String column) throws SourceException {
        JsonNode node = row.get(column);
        return node == null ? null : LivePayloads.toDouble(node, column);
    }
}
