package com.paylens.service.core.payments;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.metrics.AvgTicketSize;
import com.paylens.service.core.payments.metrics.PaymentCount;
import com.paylens.service.core.payments.metrics.PaymentProcessedAmount;
import com.paylens.service.core.payments.metrics.PaymentSuccessCount;
import com.paylens.service.core.payments.metrics.PaymentSuccessRate;
import com.paylens.service.core.payments.metrics.RetriesCount;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Locale;

public enum PaymentMetrics implements PaymentMetric {
    PAYMENT_SUCCESS_RATE,
    PAYMENT_COUNT,
    PAYMENT_SUCCESS_COUNT,
    PAYMENT_PROCESSED_AMOUNT,
    AVG_TICKET_SIZE,
    RETRIES_COUNT;

    private static final PaymentMetric SUCCESS_RATE = new PaymentSuccessRate();
    private static final PaymentMetric COUNT = new PaymentCount();
    private static final PaymentMetric SUCCESS_COUNT = new PaymentSuccessCount();
    private static final PaymentMetric PROCESSED_AMOUNT = new PaymentProcessedAmount();
    private static final PaymentMetric TICKET_SIZE = new AvgTicketSize();
    private static final PaymentMetric RETRIES = new RetriesCount();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        PaymentMetric metric = switch (this) {
            case PAYMENT_SUCCESS_RATE -> SUCCESS_RATE;
            case PAYMENT_COUNT -> COUNT;
            case PAYMENT_SUCCESS_COUNT -> SUCCESS_COUNT;
            case PAYMENT_PROCESSED_AMOUNT -> PROCESSED_AMOUNT;
            case AVG_TICKET_SIZE -> TICKET_SIZE;
            case RETRIES_COUNT -> RETRIES;
        };
        return metric.loadMetrics(dimensions, scope, filters, granularity, timeRange, dataSource);
    }
}
