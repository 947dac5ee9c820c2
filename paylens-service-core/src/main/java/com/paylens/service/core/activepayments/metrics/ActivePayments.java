package com.paylens.service.core.activepayments.metrics;

import com.paylens.service.core.activepayments.ActivePaymentsMetric;
import com.paylens.service.core.activepayments.ActivePaymentsMetricRow;
import com.paylens.service.core.activepayments.ActivePaymentsMetricsBucketIdentifier;
import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.metrics.ScopeClauses;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.FilterType;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** Distinct payments with activity since the start of the range. The end of the range is not applied. */
public class ActivePayments implements ActivePaymentsMetric {

    static final String PAYMENT_ID = "payment_id";
    static final String TIME_COLUMN = "created_at";

    @Override
    public List<MetricBucket<ActivePaymentsMetricsBucketIdentifier, ActivePaymentsMetricRow>> loadMetrics(
            AnalyticsScope scope, TimeRange timeRange, ColumnarDataSource dataSource) {
        List<ActivePaymentsMetricRow> rows = MetricQueries.execute(
                () -> {
                    QueryBuilder builder = QueryBuilder.forCollection(AnalyticsCollection.ACTIVE_PAYMENTS, dataSource)
                            .addSelectColumn(Aggregate.distinctCount(PAYMENT_ID, "count"));
                    ScopeClauses.publishableKey(builder, scope);
                    return builder.addCustomFilterClause(
                            TIME_COLUMN, QueryValue.of(timeRange.startTime()), FilterType.GREATER_THAN_EQUAL);
                },
                ActivePaymentsMetricRow.LOADER);
        ActivePaymentsMetricsBucketIdentifier bucket = ActivePaymentsMetricsBucketIdentifier.of(timeRange);
        return rows.stream().map(row -> new MetricBucket<>(bucket, row)).toList();
    }
}
