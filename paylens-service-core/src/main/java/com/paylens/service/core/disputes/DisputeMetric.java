package com.paylens.service.core.disputes;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public interface DisputeMetric {
    List<MetricBucket<DisputeMetricsBucketIdentifier, DisputeMetricRow>> loadMetrics(
            List<DisputeDimensions> dimensions,
            AnalyticsScope scope,
            DisputeFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource);
}
