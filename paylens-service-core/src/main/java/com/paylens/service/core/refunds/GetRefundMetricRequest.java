package com.paylens.service.core.refunds;

import com.paylens.service.core.model.Distribution;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.refunds.distribution.RefundDistributions;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record GetRefundMetricRequest(
        TimeRange timeRange,
        List<RefundDimensions> groupByNames,
        RefundFilters filters,
        Set<RefundMetrics> metrics,
        Granularity granularity,
        Distribution<RefundDistributions> distribution) {

    public GetRefundMetricRequest {
        Objects.requireNonNull(timeRange, "timeRange");
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
        filters = filters == null ? RefundFilters.none() : filters;
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
