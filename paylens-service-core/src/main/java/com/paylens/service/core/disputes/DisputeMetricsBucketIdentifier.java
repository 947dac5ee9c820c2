package com.paylens.service.core.disputes;

import com.paylens.service.core.query.TimeRange;
import java.time.format.DateTimeFormatter;

/** Merge key of dispute buckets; {@code startTime} does not take part in equality. */
public record DisputeMetricsBucketIdentifier(
        DisputeStage disputeStage, String connector, String currency, TimeRange timeBucket, String startTime) {

    public static DisputeMetricsBucketIdentifier of(DisputeMetricRow row, TimeRange timeBucket) {
        return new DisputeMetricsBucketIdentifier(
                row.disputeStage(),
                row.connector(),
                row.currency(),
                timeBucket,
                DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    public Key key() {
        return new Key(disputeStage, connector, currency, timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DisputeMetricsBucketIdentifier other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    public record Key(DisputeStage disputeStage, String connector, String currency, TimeRange timeBucket) {}
}
