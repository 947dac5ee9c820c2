package com.paylens.service.core.apievents;

import com.paylens.service.core.fanout.MetricTask;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.metrics.BucketMerge;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsDomain;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.telemetry.AnalyticsTelemetry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiEventAnalyticsService {

    private final AnalyticsProvider provider;
    private final MetricsFanout fanout;
    private final AnalyticsTelemetry telemetry;

    public MetricsResponse<ApiEventMetricsBucketResponse> getMetrics(
            AnalyticsScope scope, GetApiEventMetricRequest request) {
        Objects.requireNonNull(request, "metrics request");
        if (scope == null || !scope.hasMerchant()) {
            log.debug("No merchant in scope, returning empty API event metrics");
            return MetricsResponse.empty(request.timeRange());
        }
        if (request.metrics().isEmpty()) {
            throw new IllegalArgumentException("At least one API event metric is required");
        }

        List<MetricTask<Map<ApiEventMetricsBucketIdentifier, ApiEventMetricsAccumulator>>> tasks = new ArrayList<>();
        for (ApiEventMetrics metric : request.metrics()) {
            tasks.add(new MetricTask<>(metric.metricName(), () -> {
                List<MetricBucket<ApiEventMetricsBucketIdentifier, ApiEventMetricRow>> buckets = provider.loadColumnar(
                        AnalyticsDomain.API_EVENTS,
                        metric.metricName(),
                        dataSource -> metric.loadMetrics(
                                request.groupByNames(),
                                scope,
                                request.filters(),
                                request.granularity(),
                                request.timeRange(),
                                dataSource));
                telemetry.recordRowsLoaded(AnalyticsDomain.API_EVENTS, metric.metricName(), buckets.size());
                log.debug("Loaded API event metric={} rows={}", metric.metricName(), buckets.size());
                return BucketMerge.into(
                        buckets,
                        bucket -> new ApiEventMetricsAccumulator(),
                        (accumulator, row) -> accumulator.add(metric, row));
            }));
        }

        Map<ApiEventMetricsBucketIdentifier, ApiEventMetricsAccumulator> accumulators = new HashMap<>();
        fanout.run(tasks, accumulators);

        List<ApiEventMetricsBucketResponse> data = accumulators.entrySet().stream()
                .map(e -> new ApiEventMetricsBucketResponse(e.getValue().collect(), e.getKey()))
                .toList();
        return MetricsResponse.of(data, request.timeRange());
    }
}
