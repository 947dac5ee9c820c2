package com.paylens.service.core.sdkevents;

import com.paylens.service.core.query.TimeRange;
import java.time.format.DateTimeFormatter;

/** Merge key of SDK event buckets; {@code startTime} does not take part in equality. */
public record SdkEventMetricsBucketIdentifier(
        String paymentMethod,
        String platform,
        String browserName,
        String source,
        String component,
        String paymentExperience,
        TimeRange timeBucket,
        String startTime) {

    public static SdkEventMetricsBucketIdentifier of(SdkEventMetricRow row, TimeRange timeBucket) {
        return new SdkEventMetricsBucketIdentifier(
                row.paymentMethod(),
                row.platform(),
                row.browserName(),
                row.source(),
                row.component(),
                row.paymentExperience(),
                timeBucket,
                DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    public Key key() {
        return new Key(paymentMethod, platform, browserName, source, component, paymentExperience, timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SdkEventMetricsBucketIdentifier other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    public record Key(
            String paymentMethod,
            String platform,
            String browserName,
            String source,
            String component,
            String paymentExperience,
            TimeRange timeBucket) {}
}
