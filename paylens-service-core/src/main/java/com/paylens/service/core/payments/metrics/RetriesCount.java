package com.paylens.service.core.payments.metrics;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.metrics.ScopeClauses;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.IntentStatus;
import com.paylens.service.core.payments.PaymentDimensions;
import com.paylens.service.core.payments.PaymentFilters;
import com.paylens.service.core.payments.PaymentMetric;
import com.paylens.service.core.payments.PaymentMetricRow;
import com.paylens.service.core.payments.PaymentMetricsBucketIdentifier;
import com.paylens.service.core.payments.PaymentQueries;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.BucketWindows;
import com.paylens.service.core.query.FilterType;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/**
 * Succeeded payment intents that needed more than one attempt. Intents carry none of the attempt
 * dimensions, so the result is only split by time and dimensions and filters are ignored.
 */
public class RetriesCount implements PaymentMetric {

    @Override
    public List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        List<PaymentMetricRow> rows = MetricQueries.execute(
                () -> {
                    QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.PAYMENT_INTENT, dataSource)
                            .addSelectColumn(Aggregate.count("count"))
                            .addSelectColumn(Aggregate.sum("amount", "total"))
                            .addSelectColumn(Aggregate.min(PaymentQueries.TIME_COLUMN, PaymentQueries.START_BUCKET))
                            .addSelectColumn(Aggregate.max(PaymentQueries.TIME_COLUMN, PaymentQueries.END_BUCKET))
                            .addCustomFilterClause("attempt_count", QueryValue.of(1), FilterType.GREATER_THAN)
                            .addFilterClause("status", QueryValue.of(IntentStatus.SUCCEEDED));
                    ScopeClauses.merchant(builder, scope);
                    builder.addTimeRangeClause(timeRange, PaymentQueries.TIME_COLUMN);
                    if (granularity != null) {
                        builder.addGranularityClause(granularity, PaymentQueries.TIME_COLUMN);
                    }
                    return builder;
                },
                PaymentMetricRow.LOADER);
        return MetricQueries.toBuckets(
                rows,
                row -> PaymentMetricsBucketIdentifier.overall(
                        BucketWindows.canonical(granularity, timeRange, row.startBucket(), row.endBucket())));
    }
}
