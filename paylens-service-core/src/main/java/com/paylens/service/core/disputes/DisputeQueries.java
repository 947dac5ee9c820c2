package com.paylens.service.core.disputes;

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

public final class DisputeQueries {

    public static final String TIME_COLUMN = "created_at";
    public static final String STATUS_COLUMN = "dispute_status";
    public static final String AMOUNT_COLUMN = "dispute_amount";

    private DisputeQueries() {}

    public static QueryBuilder disputes(
            List<DisputeDimensions> dimensions,
            AnalyticsScope scope,
            DisputeFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource)
            throws QueryBuildingException {
        QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.DISPUTE, dataSource);
        for (DisputeDimensions dimension : dimensions) {
            builder.addSelectColumn(dimension.column());
        }
        builder.addSelectColumn(Aggregate.min(TIME_COLUMN, "start_bucket"));
        builder.addSelectColumn(Aggregate.max(TIME_COLUMN, "end_bucket"));
        ScopeClauses.merchant(builder, scope);
        filters.applyTo(builder);
        builder.addTimeRangeClause(timeRange, TIME_COLUMN);
        for (DisputeDimensions dimension : dimensions) {
            builder.addGroupByClause(dimension.column());
        }
        if (granularity != null) {
            builder.addGranularityClause(granularity, TIME_COLUMN);
        }
        return builder;
    }

    public static List<MetricBucket<DisputeMetricsBucketIdentifier, DisputeMetricRow>> bucketed(
            List<DisputeMetricRow> rows, Granularity granularity, TimeRange timeRange) {
        return MetricQueries.toBuckets(
                rows,
                row -> DisputeMetricsBucketIdentifier.of(
                        row, BucketWindows.canonical(granularity, timeRange, row.startBucket(), row.endBucket())));
    }
}
