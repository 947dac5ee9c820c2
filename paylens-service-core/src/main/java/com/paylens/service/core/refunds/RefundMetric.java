package com.paylens.service.core.refunds;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public interface RefundMetric {
    List<MetricBucket<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
            List<RefundDimensions> dimensions,
            AnalyticsScope scope,
            RefundFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource);
}
