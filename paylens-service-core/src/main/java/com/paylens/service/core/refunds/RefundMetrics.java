package com.paylens.service.core.refunds;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.refunds.metrics.RefundCount;
import com.paylens.service.core.refunds.metrics.RefundProcessedAmount;
import com.paylens.service.core.refunds.metrics.RefundSuccessCount;
import com.paylens.service.core.refunds.metrics.RefundSuccessRate;
import java.util.List;
import java.util.Locale;

public enum RefundMetrics implements RefundMetric {
    REFUND_SUCCESS_RATE,
    REFUND_COUNT,
    REFUND_SUCCESS_COUNT,
    REFUND_PROCESSED_AMOUNT;

    private static final RefundMetric SUCCESS_RATE = new RefundSuccessRate();
    private static final RefundMetric COUNT = new RefundCount();
    private static final RefundMetric SUCCESS_COUNT = new RefundSuccessCount();
    private static final RefundMetric PROCESSED_AMOUNT = new RefundProcessedAmount();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
            List<RefundDimensions> dimensions,
            AnalyticsScope scope,
            RefundFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        RefundMetric metric = switch (this) {
            case REFUND_SUCCESS_RATE -> SUCCESS_RATE;
            case REFUND_COUNT -> COUNT;
            case REFUND_SUCCESS_COUNT -> SUCCESS_COUNT;
            case REFUND_PROCESSED_AMOUNT -> PROCESSED_AMOUNT;
        };
        return metric.loadMetrics(dimensions, scope, filters, granularity, timeRange, dataSource);
    }
}
