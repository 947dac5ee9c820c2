package com.paylens.service.core.payments;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public interface PaymentMetric {
    List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource);
}
