package com.paylens.service.core.sdkevents;

import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** SDK events are only recorded in the columnar store. */
public interface SdkEventMetric {
    List<MetricBucket<SdkEventMetricsBucketIdentifier, SdkEventMetricRow>> loadMetrics(
            List<SdkEventDimensions> dimensions,
            AnalyticsScope scope,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource);
}
