package com.paylens.service.core.apievents;

import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public interface ApiEventMetric {
    List<MetricBucket<ApiEventMetricsBucketIdentifier, ApiEventMetricRow>> loadMetrics(
            List<ApiEventDimensions> dimensions,
            AnalyticsScope scope,
            ApiEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource);
}
