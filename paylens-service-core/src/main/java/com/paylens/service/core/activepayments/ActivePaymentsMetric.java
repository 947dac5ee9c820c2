package com.paylens.service.core.activepayments;

import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public interface ActivePaymentsMetric {
    List<MetricBucket<ActivePaymentsMetricsBucketIdentifier, ActivePaymentsMetricRow>> loadMetrics(
            AnalyticsScope scope, TimeRange timeRange, ColumnarDataSource dataSource);
}
