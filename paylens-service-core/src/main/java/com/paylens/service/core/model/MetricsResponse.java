package com.paylens.service.core.model;

import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** Buckets of one metrics request plus a single metadata entry echoing the requested time range. */
public record MetricsResponse<T>(List<T> queryData, List<AnalyticsMetadata> metaData) {

    public MetricsResponse {
        queryData = List.copyOf(queryData);
        metaData = List.copyOf(metaData);
    }

    public static <T> MetricsResponse<T> of(List<T> queryData, TimeRange timeRange) {
        return new MetricsResponse<>(queryData, List.of(new AnalyticsMetadata(timeRange)));
    }

    public static <T> MetricsResponse<T> empty(TimeRange timeRange) {
        return of(List.of(), timeRange);
    }
}
