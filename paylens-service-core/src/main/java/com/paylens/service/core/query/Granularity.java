package com.paylens.service.core.query;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/** Width of the time buckets a metric query groups by. Buckets are aligned to the UTC epoch. */
public enum Granularity {
    ONE_MIN(Duration.ofMinutes(1)),
    FIVE_MIN(Duration.ofMinutes(5)),
    FIFTEEN_MIN(Duration.ofMinutes(15)),
    THIRTY_MIN(Duration.ofMinutes(30)),
    ONE_HOUR(Duration.ofHours(1)),
    ONE_DAY(Duration.ofDays(1));

    private final Duration duration;

    Granularity(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }

    public long minutes() {
        return duration.toMinutes();
    }

    /** Start of the bucket containing {@code value}. An instant already on a boundary is returned unchanged. */
    public Instant clipToStart(Instant value) {
        long width = duration.getSeconds();
        long seconds = Math.floorDiv(value.getEpochSecond(), width) * width;
        return Instant.ofEpochSecond(seconds);
    }

    /** Last whole second of the bucket containing {@code value}. */
    public Instant clipToEnd(Instant value) {
        return clipToStart(value).plus(duration).minusSeconds(1);
    }

    public static Granularity fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Granularity cannot be null or empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "1M", "ONE_MIN", "PT1M" -> ONE_MIN;
            case "5M", "FIVE_MIN", "PT5M" -> FIVE_MIN;
            case "15M", "FIFTEEN_MIN", "PT15M" -> FIFTEEN_MIN;
            case "30M", "THIRTY_MIN", "PT30M" -> THIRTY_MIN;
            case "1H", "60M", "ONE_HOUR", "PT1H" -> ONE_HOUR;
            case "1D", "24H", "ONE_DAY", "P1D", "PT24H" -> ONE_DAY;
            default -> throw new IllegalArgumentException("Unsupported granularity: " + value);
        };
    }
}
