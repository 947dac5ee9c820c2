package com.paylens.service.core.activepayments;

import com.paylens.service.core.activepayments.metrics.ActivePayments;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Locale;

public enum ActivePaymentsMetrics implements ActivePaymentsMetric {
    ACTIVE_PAYMENTS;

    private static final ActivePaymentsMetric ACTIVE = new ActivePayments();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<ActivePaymentsMetricsBucketIdentifier, ActivePaymentsMetricRow>> loadMetrics(
            AnalyticsScope scope, TimeRange timeRange, ColumnarDataSource dataSource) {
        ActivePaymentsMetric metric = switch (this) {
            case ACTIVE_PAYMENTS -> ACTIVE;
        };
        return metric.loadMetrics(scope, timeRange, dataSource);
    }
}
