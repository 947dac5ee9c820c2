package com.paylens.service.core.refunds.metrics;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.refunds.RefundDimensions;
import com.paylens.service.core.refunds.RefundFilters;
import com.paylens.service.core.refunds.RefundMetric;
import com.paylens.service.core.refunds.RefundMetricRow;
import com.paylens.service.core.refunds.RefundMetricsBucketIdentifier;
import com.paylens.service.core.refunds.RefundQueries;
import java.util.List;

/** Refund counts split by status; status is dropped from the bucket unless the caller grouped by it. */
public class RefundSuccessRate implements RefundMetric {

    @Override
    public List<MetricBucket<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
            List<RefundDimensions> dimensions,
            AnalyticsScope scope,
            RefundFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        boolean statusRequested = dimensions.contains(RefundDimensions.REFUND_STATUS);
        List<RefundMetricRow> rows = MetricQueries.execute(
                () -> {
                    QueryBuilder builder = RefundQueries.refunds(
                                    dimensions, scope, filters, granularity, timeRange, dataSource)
                            .addSelectColumn(Aggregate.count("count"));
                    if (!statusRequested) {
                        builder.addSelectColumn(RefundDimensions.REFUND_STATUS.column())
                                .addGroupByClause(RefundDimensions.REFUND_STATUS.column());
                    }
                    return builder;
                },
                RefundMetricRow.LOADER);
        List<MetricBucket<RefundMetricsBucketIdentifier, RefundMetricRow>> buckets =
                RefundQueries.bucketed(rows, granularity, timeRange);
        if (statusRequested) {
            return buckets;
        }
        return buckets.stream()
                .map(bucket -> new MetricBucket<>(bucket.bucket().withoutStatus(), bucket.row()))
                .toList();
    }
}
