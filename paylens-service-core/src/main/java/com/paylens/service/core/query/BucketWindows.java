package com.paylens.service.core.query;

import java.time.Instant;

/**
 * Canonical time window of a result bucket. Independent queries over the same request produce the same
 * window for the same bucket no matter which rows each of them observed.
 */
public final class BucketWindows {

    private BucketWindows() {}

    /**
     * With a granularity, the observed min/max timestamps are clipped to the enclosing bucket and a missing
     * observation falls back to the requested bound. Without one the requested range is the only bucket.
     */
    public static TimeRange canonical(
            Granularity granularity, TimeRange requested, Instant observedStart, Instant observedEnd) {
        if (granularity == null) {
            return requested;
        }
        Instant start = observedStart != null ? granularity.clipToStart(observedStart) : requested.startTime();
        Instant end = observedEnd != null ? granularity.clipToEnd(observedEnd) : requested.endTime();
        return new TimeRange(start, end);
    }
}
