package com.paylens.service.core.apievents;

import com.paylens.service.core.apievents.metrics.ApiCount;
import com.paylens.service.core.apievents.metrics.Latency;
import com.paylens.service.core.apievents.metrics.StatusCodeCount;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Locale;

public enum ApiEventMetrics implements ApiEventMetric {
    LATENCY,
    API_COUNT,
    STATUS_CODE_COUNT;

    private static final ApiEventMetric LATENCY_METRIC = new Latency();
    private static final ApiEventMetric COUNT = new ApiCount();
    private static final ApiEventMetric STATUS_CODES = new StatusCodeCount();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<ApiEventMetricsBucketIdentifier, ApiEventMetricRow>> loadMetrics(
            List<ApiEventDimensions> dimensions,
            AnalyticsScope scope,
            ApiEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource) {
        ApiEventMetric metric = switch (this) {
            case LATENCY -> LATENCY_METRIC;
            case API_COUNT -> COUNT;
            case STATUS_CODE_COUNT -> STATUS_CODES;
        };
        return metric.loadMetrics(dimensions, scope, filters, granularity, timeRange, dataSource);
    }
}
