package com.paylens.service.core.sdkevents;

import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.sdkevents.metrics.AveragePaymentTime;
import com.paylens.service.core.sdkevents.metrics.SdkEventCount;
import java.util.List;
import java.util.Locale;

public enum SdkEventMetrics implements SdkEventMetric {
    PAYMENT_ATTEMPTS,
    SDK_RENDERED_COUNT,
    SDK_INITIATED_COUNT,
    PAYMENT_METHOD_SELECTED_COUNT,
    PAYMENT_DATA_FILLED_COUNT,
    AVERAGE_PAYMENT_TIME;

    private static final SdkEventMetric ATTEMPTS = new SdkEventCount(SdkEventName.PAYMENT_ATTEMPT);
    private static final SdkEventMetric RENDERED = new SdkEventCount(SdkEventName.APP_RENDERED);
    private static final SdkEventMetric INITIATED = new SdkEventCount(SdkEventName.ELEMENTS_CALLED);
    private static final SdkEventMetric METHOD_SELECTED = new SdkEventCount(SdkEventName.PAYMENT_METHOD_CHANGED);
    private static final SdkEventMetric DATA_FILLED = new SdkEventCount(SdkEventName.PAYMENT_DATA_FILLED);
    private static final SdkEventMetric PAYMENT_TIME = new AveragePaymentTime();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<SdkEventMetricsBucketIdentifier, SdkEventMetricRow>> loadMetrics(
            List<SdkEventDimensions> dimensions,
            AnalyticsScope scope,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource) {
        SdkEventMetric metric = switch (this) {
            case PAYMENT_ATTEMPTS -> ATTEMPTS;
            case SDK_RENDERED_COUNT -> RENDERED;
            case SDK_INITIATED_COUNT -> INITIATED;
            case PAYMENT_METHOD_SELECTED_COUNT -> METHOD_SELECTED;
            case PAYMENT_DATA_FILLED_COUNT -> DATA_FILLED;
            case AVERAGE_PAYMENT_TIME -> PAYMENT_TIME;
        };
        return metric.loadMetrics(dimensions, scope, filters, granularity, timeRange, dataSource);
    }
}
