package com.paylens.service.core.refunds;

import com.paylens.service.core.query.TimeRange;
import java.time.format.DateTimeFormatter;

/** Merge key of refund buckets; {@code startTime} does not take part in equality. */
public record RefundMetricsBucketIdentifier(
        String currency,
        RefundStatus refundStatus,
        String connector,
        RefundType refundType,
        TimeRange timeBucket,
        String startTime) {

    public static RefundMetricsBucketIdentifier of(RefundDimensionRow row, TimeRange timeBucket) {
        return new RefundMetricsBucketIdentifier(
                row.currency(),
                row.refundStatus(),
                row.connector(),
                row.refundType(),
                timeBucket,
                DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    public RefundMetricsBucketIdentifier withoutStatus() {
        return new RefundMetricsBucketIdentifier(currency, null, connector, refundType, timeBucket, startTime);
    }

    public Key key() {
        return new Key(currency, refundStatus, connector, refundType, timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RefundMetricsBucketIdentifier other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    public record Key(
            String currency, RefundStatus refundStatus, String connector, RefundType refundType, TimeRange timeBucket) {}
}
