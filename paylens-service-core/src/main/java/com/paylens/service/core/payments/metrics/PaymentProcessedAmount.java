package com.paylens.service.core.payments.metrics;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.AttemptStatus;
import com.paylens.service.core.payments.PaymentDimensions;
import com.paylens.service.core.payments.PaymentFilters;
import com.paylens.service.core.payments.PaymentMetric;
import com.paylens.service.core.payments.PaymentMetricRow;
import com.paylens.service.core.payments.PaymentMetricsBucketIdentifier;
import com.paylens.service.core.payments.PaymentQueries;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** Sum of charged amounts, in minor units of each row's currency. */
public class PaymentProcessedAmount implements PaymentMetric {

    @Override
    public List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        List<PaymentMetricRow> rows = MetricQueries.execute(
                () -> PaymentQueries.attempts(dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(Aggregate.sum("amount", "total"))
                        .addFilterClause(
                                PaymentDimensions.PAYMENT_STATUS.column(), QueryValue.of(AttemptStatus.CHARGED)),
                PaymentMetricRow.LOADER);
        return PaymentQueries.bucketed(rows, granularity, timeRange);
    }
}
