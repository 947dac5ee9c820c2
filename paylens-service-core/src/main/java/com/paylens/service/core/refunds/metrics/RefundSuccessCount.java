package com.paylens.service.core.refunds.metrics;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.refunds.RefundDimensions;
import com.paylens.service.core.refunds.RefundFilters;
import com.paylens.service.core.refunds.RefundMetric;
import com.paylens.service.core.refunds.RefundMetricRow;
import com.paylens.service.core.refunds.RefundMetricsBucketIdentifier;
import com.paylens.service.core.refunds.RefundQueries;
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.refunds.RefundStatus;
import java.util.List;

/** Refunds that reached {@code success}. */
public class RefundSuccessCount implements RefundMetric {

    @Override
    public List<MetricBucket<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
            List<RefundDimensions> dimensions,
            AnalyticsScope scope,
            RefundFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        List<RefundMetricRow> rows = MetricQueries.execute(
                () -> RefundQueries.refunds(dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(Aggregate.count("count"))
                        .addFilterClause(RefundDimensions.REFUND_STATUS.column(), QueryValue.of(RefundStatus.SUCCESS)),
                RefundMetricRow.LOADER);
        return RefundQueries.bucketed(rows, granularity, timeRange);
    }
}
