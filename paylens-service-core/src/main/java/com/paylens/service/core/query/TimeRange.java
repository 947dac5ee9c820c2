package com.paylens.service.core.query;

import java.time.Instant;
import java.util.Objects;

/** Requested time range. The end is optional and means "up to now" when absent. */
public record TimeRange(Instant startTime, Instant endTime) {

    public TimeRange {
        Objects.requireNonNull(startTime, "startTime");
        if (endTime != null && endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("The requested end time must not be before start");
        }
    }

    public static TimeRange of(Instant startTime, Instant endTime) {
        return new TimeRange(startTime, endTime);
    }

    public static TimeRange since(Instant startTime) {
        return new TimeRange(startTime, null);
    }
}
