package com.paylens.service.core.payments;

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

/** Clauses every payment attempt query starts from. */
public final class PaymentQueries {

    public static final String TIME_COLUMN = "created_at";
    public static final String START_BUCKET = "start_bucket";
    public static final String END_BUCKET = "end_bucket";

    private PaymentQueries() {}

    /**
     * Selects and groups by the requested dimensions, adds the bucket bounds, the caller's scope, the
     * filters, the time range and the granularity. Metric specific aggregates and predicates come on top.
     */
    public static QueryBuilder attempts(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource)
            throws QueryBuildingException {
        QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.PAYMENT, dataSource);
        for (PaymentDimensions dimension : dimensions) {
            builder.addSelectColumn(dimension.column());
        }
        builder.addSelectColumn(Aggregate.min(TIME_COLUMN, START_BUCKET));
        builder.addSelectColumn(Aggregate.max(TIME_COLUMN, END_BUCKET));
        ScopeClauses.merchant(builder, scope);
        filters.applyTo(builder);
        builder.addTimeRangeClause(timeRange, TIME_COLUMN);
        for (PaymentDimensions dimension : dimensions) {
            builder.addGroupByClause(dimension.column());
        }
        if (granularity != null) {
            builder.addGranularityClause(granularity, TIME_COLUMN);
        }
        return builder;
    }

    public static <R extends PaymentDimensionRow> List<MetricBucket<PaymentMetricsBucketIdentifier, R>> bucketed(
            List<R> rows, Granularity granularity, TimeRange timeRange) {
        return MetricQueries.toBuckets(
                rows,
                row -> PaymentMetricsBucketIdentifier.of(
                        row, BucketWindows.canonical(granularity, timeRange, row.startBucket(), row.endBucket())));
    }
}
