package com.paylens.service.core.payments.distribution;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.PaymentDimensions;
import com.paylens.service.core.payments.PaymentFilters;
import com.paylens.service.core.payments.PaymentMetricsBucketIdentifier;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Locale;

public enum PaymentDistributions implements PaymentDistribution {
    PAYMENT_ERROR_MESSAGE;

    private static final PaymentDistribution ERROR_MESSAGE = new PaymentErrorMessageDistribution();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentDistributionRow>> loadDistribution(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        PaymentDistribution distribution = switch (this) {
            case PAYMENT_ERROR_MESSAGE -> ERROR_MESSAGE;
        };
        return distribution.loadDistribution(dimensions, scope, filters, granularity, timeRange, dataSource);
    }
}
