package com.paylens.service.core.activepayments;

import com.paylens.service.core.query.TimeRange;
import java.time.format.DateTimeFormatter;

/** Active payments have no dimensions; the only bucket is the requested range. */
public record ActivePaymentsMetricsBucketIdentifier(TimeRange timeBucket, String startTime) {

    public static ActivePaymentsMetricsBucketIdentifier of(TimeRange timeBucket) {
        return new ActivePaymentsMetricsBucketIdentifier(
                timeBucket, DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    public Key key() {
        return new Key(timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ActivePaymentsMetricsBucketIdentifier other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    public record Key(TimeRange timeBucket) {}
}
