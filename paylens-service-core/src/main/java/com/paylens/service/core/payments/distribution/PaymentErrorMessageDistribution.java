package com.paylens.service.core.payments.distribution;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.AttemptStatus;
import com.paylens.service.core.payments.PaymentDimensions;
import com.paylens.service.core.payments.PaymentFilters;
import com.paylens.service.core.payments.PaymentMetricsBucketIdentifier;
import com.paylens.service.core.payments.PaymentQueries;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** Failed attempts per error message. */
public class PaymentErrorMessageDistribution implements PaymentDistribution {

    static final String ERROR_MESSAGE = "error_message";

    @Override
    public List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentDistributionRow>> loadDistribution(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        List<PaymentDistributionRow> rows = MetricQueries.execute(
                () -> PaymentQueries.attempts(dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(ERROR_MESSAGE)
                        .addSelectColumn(Aggregate.count("count"))
                        .addFilterClause(
                                PaymentDimensions.PAYMENT_STATUS.column(), QueryValue.of(AttemptStatus.FAILURE))
                        .addNotNullClause(ERROR_MESSAGE)
                        .addGroupByClause(ERROR_MESSAGE),
                PaymentDistributionRow.LOADER);
        return PaymentQueries.bucketed(rows, granularity, timeRange);
    }
}
