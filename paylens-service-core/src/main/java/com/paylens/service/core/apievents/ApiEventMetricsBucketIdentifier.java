package com.paylens.service.core.apievents;

import com.paylens.service.core.query.TimeRange;
import java.time.format.DateTimeFormatter;

public record ApiEventMetricsBucketIdentifier(
        Integer statusCode, String flowType, String apiFlow, TimeRange timeBucket, String startTime) {

    public static ApiEventMetricsBucketIdentifier of(ApiEventMetricRow row, TimeRange timeBucket) {
        return new ApiEventMetricsBucketIdentifier(
                row.statusCode(),
                row.flowType(),
                row.apiFlow(),
                timeBucket,
                DateTimeFormatter.ISO_INSTANT.format(timeBucket.startTime()));
    }

    public Key key() {
        return new Key(statusCode, flowType, apiFlow, timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ApiEventMetricsBucketIdentifier other && key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    public record Key(Integer statusCode, String flowType, String apiFlow, TimeRange timeBucket) {}
}
