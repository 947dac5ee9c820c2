package com.paylens.service.core.payments.metrics;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.PaymentDimensions;
import com.paylens.service.core.payments.PaymentFilters;
import com.paylens.service.core.payments.PaymentMetric;
import com.paylens.service.core.payments.PaymentMetricRow;
import com.paylens.service.core.payments.PaymentMetricsBucketIdentifier;
import com.paylens.service.core.payments.PaymentQueries;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/**
 * Attempt counts split by status; the rate is computed when buckets are collected. Rows are always grouped
 * by status, but the status only stays in the bucket when the caller grouped by it.
 */
public class PaymentSuccessRate implements PaymentMetric {

    @Override
    public List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        boolean statusRequested = dimensions.contains(PaymentDimensions.PAYMENT_STATUS);
        List<PaymentMetricRow> rows = MetricQueries.execute(
                () -> {
                    QueryBuilder builder = PaymentQueries.attempts(
                                    dimensions, scope, filters, granularity, timeRange, dataSource)
                            .addSelectColumn(Aggregate.count("count"));
                    if (!statusRequested) {
                        builder.addSelectColumn(PaymentDimensions.PAYMENT_STATUS.column())
                                .addGroupByClause(PaymentDimensions.PAYMENT_STATUS.column());
                    }
                    return builder;
                },
                PaymentMetricRow.LOADER);
        List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> buckets =
                PaymentQueries.bucketed(rows, granularity, timeRange);
        if (statusRequested) {
            return buckets;
        }
        return buckets.stream()
                .map(bucket -> new MetricBucket<>(bucket.bucket().withoutStatus(), bucket.row()))
                .toList();
    }
}
