package com.paylens.service.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.function.Function;

/**
 * Null-tolerant accessors over one element of a columnar {@code FORMAT JSON} response.
 *
 * <p>64-bit integers and decimals arrive quoted, date-times arrive as {@code yyyy-MM-dd HH:mm:ss[.fff]} in
 * UTC; both are accepted alongside plain JSON numbers.
 */
public final class ColumnarRow {

    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private final JsonNode node;

    private ColumnarRow(JsonNode node) {
        this.node = node;
    }

    public static ColumnarRow of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Columnar row must be a JSON object but was " + node);
        }
        return new ColumnarRow(node);
    }

    private JsonNode field(String column) {
        JsonNode value = node.get(column);
        return value == null || value.isNull() ? null : value;
    }

    public String string(String column) {
        JsonNode value = field(column);
        return value == null ? null : value.asText();
    }

    public <E extends Enum<E>> E enumValue(String column, Function<String, E> parser) {
        String raw = string(column);
        return raw == null || raw.isEmpty() ? null : parser.apply(raw);
    }

    public Long longValue(String column) {
        JsonNode value = field(column);
        if (value == null) {
            return null;
        }
        return value.isNumber() ? value.longValue() : Long.parseLong(value.asText().trim());
    }

    public Integer intValue(String column) {
        JsonNode value = field(column);
        if (value == null) {
            return null;
        }
        return value.isNumber() ? value.intValue() : Integer.parseInt(value.asText().trim());
    }

    public BigDecimal decimal(String column) {
        JsonNode value = field(column);
        if (value == null) {
            return null;
        }
        return value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText().trim());
    }

    public Instant instant(String column) {
        String raw = string(column);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return LocalDateTime.parse(raw.trim(), DATE_TIME).toInstant(ZoneOffset.UTC);
    }
}
