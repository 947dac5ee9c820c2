package com.paylens.service.core.apievents;

import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record GetApiEventMetricRequest(
        TimeRange timeRange,
        List<ApiEventDimensions> groupByNames,
        ApiEventFilters filters,
        Set<ApiEventMetrics> metrics,
        Granularity granularity) {

    public GetApiEventMetricRequest {
        Objects.requireNonNull(timeRange, "timeRange");
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
        filters = filters == null ? ApiEventFilters.none() : filters;
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
