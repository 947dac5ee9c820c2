package com.paylens.service.core.refunds;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.AnalyticsDataSource;
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

public final class RefundQueries {

    public static final String TIME_COLUMN = "created_at";

    private RefundQueries() {}

    public static QueryBuilder refunds(
            List<RefundDimensions> dimensions,
            AnalyticsScope scope,
            RefundFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource)
            throws QueryBuildingException {
        QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.REFUND, dataSource);
        for (RefundDimensions dimension : dimensions) {
            builder.addSelectColumn(dimension.column());
        }
        builder.addSelectColumn(Aggregate.min(TIME_COLUMN, "start_bucket"));
        builder.addSelectColumn(Aggregate.max(TIME_COLUMN, "end_bucket"));
        ScopeClauses.merchant(builder, scope);
        filters.applyTo(builder);
        builder.addTimeRangeClause(timeRange, TIME_COLUMN);
        for (RefundDimensions dimension : dimensions) {
            builder.addGroupByClause(dimension.column());
        }
        if (granularity != null) {
            builder.addGranularityClause(granularity, TIME_COLUMN);
        }
        return builder;
    }

    public static <R extends RefundDimensionRow> List<MetricBucket<RefundMetricsBucketIdentifier, R>> bucketed(
            List<R> rows, Granularity granularity, TimeRange timeRange) {
        return MetricQueries.toBuckets(
                rows,
                row -> RefundMetricsBucketIdentifier.of(
                        row, BucketWindows.canonical(granularity, timeRange, row.startBucket(), row.endBucket())));
    }
}
