package com.paylens.service.core.sdkevents;

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
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public final class SdkEventQueries {

    public static final String TIME_COLUMN = "created_at";
    public static final String EVENT_NAME = "event_name";

    private SdkEventQueries() {}

    /** Events named {@code eventName} published under the scope's publishable key. */
    public static QueryBuilder events(
            SdkEventName eventName,
            List<SdkEventDimensions> dimensions,
            AnalyticsScope scope,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource)
            throws QueryBuildingException {
        QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.SDK_EVENTS, dataSource);
        for (SdkEventDimensions dimension : dimensions) {
            builder.addSelectColumn(dimension.column());
        }
        builder.addSelectColumn(Aggregate.min(TIME_COLUMN, "start_bucket"));
        builder.addSelectColumn(Aggregate.max(TIME_COLUMN, "end_bucket"));
        ScopeClauses.publishableKey(builder, scope);
        builder.addFilterClause(EVENT_NAME, QueryValue.of(eventName));
        filters.applyTo(builder);
        builder.addTimeRangeClause(timeRange, TIME_COLUMN);
        for (SdkEventDimensions dimension : dimensions) {
            builder.addGroupByClause(dimension.column());
        }
        if (granularity != null) {
            builder.addGranularityClause(granularity, TIME_COLUMN);
        }
        return builder;
    }

    public static List<MetricBucket<SdkEventMetricsBucketIdentifier, SdkEventMetricRow>> bucketed(
            List<SdkEventMetricRow> rows, Granularity granularity, TimeRange timeRange) {
        return MetricQueries.toBuckets(
                rows,
                row -> SdkEventMetricsBucketIdentifier.of(
                        row, BucketWindows.canonical(granularity, timeRange, row.startBucket(), row.endBucket())));
    }
}
