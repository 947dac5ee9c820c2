package com.paylens.service.core.apievents;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.metrics.ScopeClauses;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.BucketWindows;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public final class ApiEventQueries {

    public static final String TIME_COLUMN = "created_at";

    private ApiEventQueries() {}

    public static QueryBuilder events(
            List<ApiEventDimensions> dimensions,
            AnalyticsScope scope,
            ApiEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource)
            throws QueryBuildingException {
        QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.API_EVENTS, dataSource);
        for (ApiEventDimensions dimension : dimensions) {
            builder.addSelectColumn(dimension.column());
        }
        builder.addSelectColumn(Aggregate.min(TIME_COLUMN, "start_bucket"));
        builder.addSelectColumn(Aggregate.max(TIME_COLUMN, "end_bucket"));
        ScopeClauses.merchant(builder, scope);
        filters.applyTo(builder);
        builder.addTimeRangeClause(timeRange, TIME_COLUMN);
        for (ApiEventDimensions dimension : dimensions) {
            builder.addGroupByClause(dimension.column());
        }
        if (granularity != null) {
            builder.addGranularityClause(granularity, TIME_COLUMN);
        }
        return builder;
    }

    public static List<MetricBucket<ApiEventMetricsBucketIdentifier, ApiEventMetricRow>> bucketed(
            List<ApiEventMetricRow> rows, Granularity granularity, TimeRange timeRange) {
        return MetricQueries.toBuckets(
                rows,
                row -> ApiEventMetricsBucketIdentifier.of(
                        row, BucketWindows.canonical(granularity, timeRange, row.startBucket(), row.endBucket())));
    }
}
