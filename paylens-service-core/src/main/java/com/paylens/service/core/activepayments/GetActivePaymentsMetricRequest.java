package com.paylens.service.core.activepayments;

import com.paylens.service.core.query.TimeRange;
import java.util.Objects;
import java.util.Set;

public record GetActivePaymentsMetricRequest(TimeRange timeRange, Set<ActivePaymentsMetrics> metrics) {

    public GetActivePaymentsMetricRequest {
        Objects.requireNonNull(timeRange, "timeRange");
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
