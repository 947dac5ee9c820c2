package com.paylens.service.core.sdkevents;

import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record GetSdkEventMetricRequest(
        TimeRange timeRange,
        List<SdkEventDimensions> groupByNames,
        SdkEventFilters filters,
        Set<SdkEventMetrics> metrics,
        Granularity granularity) {

    public GetSdkEventMetricRequest {
        Objects.requireNonNull(timeRange, "timeRange");
        groupByNames = groupByNames == null ? List.of() : List.copyOf(groupByNames);
        filters = filters == null ? SdkEventFilters.none() : filters;
        metrics = metrics == null ? Set.of() : Set.copyOf(metrics);
    }
}
