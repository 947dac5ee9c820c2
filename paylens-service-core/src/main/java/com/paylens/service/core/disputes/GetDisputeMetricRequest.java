package com.paylens.service.core.disputes;

import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record GetDisputeMetricRequest(
        TimeRange timeRange,
        List<DisputeDimensions> groupByNames,
        DisputeFilters filters,
        Set<DisputeMetrics> metrics,
        Granularity granularity) {

    public GetDisputeMetricRequest {
        Objects.requireNonNull(timeRange, "timeRange");
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
        filters = filters == null ? DisputeFilters.none() : filters;
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
