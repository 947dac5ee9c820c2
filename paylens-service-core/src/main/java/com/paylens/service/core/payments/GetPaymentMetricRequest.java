package com.paylens.service.core.payments;

import com.paylens.service.core.model.Distribution;
import com.paylens.service.core.payments.distribution.PaymentDistributions;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * @param granularity {@code null} for one bucket spanning the whole range
 * @param distribution {@code null} when no breakdown is wanted
 */
public record GetPaymentMetricRequest(
        TimeRange timeRange,
        List<PaymentDimensions> groupByNames,
        PaymentFilters filters,
        Set<PaymentMetrics> metrics,
        Granularity granularity,
        Distribution<PaymentDistributions> distribution) {

    public GetPaymentMetricRequest {
        Objects.requireNonNull(timeRange, "timeRange");
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
        filters = filters == null ? PaymentFilters.none() : filters;
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
