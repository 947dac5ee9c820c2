package com.paylens.service.core.payments;

import com.paylens.service.core.query.TimeRange;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Merge key of payment buckets. Equality covers the dimensions and the canonical time window;
 * {@code startTime} is a display copy of the window start and is ignored.
 */
public record PaymentMetricsBucketIdentifier(
        String currency,
        AttemptStatus status,
        String connector,
        AuthenticationType authType,
        String paymentMethod,
        String paymentMethodType,
        String clientSource,
        String clientVersion,
        TimeRange timeBucket,
        String startTime) {

    public static PaymentMetricsBucketIdentifier of(PaymentDimensionRow row, TimeRange timeBucket) {
        Objects.requireNonNull(timeBucket, "timeBucket");
        return new PaymentMetricsBucketIdentifier(
                row.currency(),
                row.status(),
                row.connector(),
                row.authenticationType(),
                row.paymentMethod(),
                row.paymentMethodType(),
                row.clientSource(),
                row.clientVersion(),
                timeBucket,
                DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    /** Same bucket with every dimension cleared, for metrics that are not broken down. */
    public static PaymentMetricsBucketIdentifier overall(TimeRange timeBucket) {
        return new PaymentMetricsBucketIdentifier(
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                timeBucket,
                DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    public PaymentMetricsBucketIdentifier withoutStatus() {
        return new PaymentMetricsBucketIdentifier(
                currency,
                null,
                connector,
                authType,
                paymentMethod,
                paymentMethodType,
                clientSource,
                clientVersion,
                timeBucket,
                startTime);
    }

    public Key key() {
        return new Key(
                currency,
                status,
                connector,
                authType,
                paymentMethod,
                paymentMethodType,
                clientSource,
                clientVersion,
                timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PaymentMetricsBucketIdentifier other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    public record Key(
            String currency,
            AttemptStatus status,
            String connector,
            AuthenticationType authType,
            String paymentMethod,
            String paymentMethodType,
            String clientSource,
            String clientVersion,
            TimeRange timeBucket) {}
}
