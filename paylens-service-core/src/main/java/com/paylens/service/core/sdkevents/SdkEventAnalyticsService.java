package com.paylens.service.core.sdkevents;

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

/** SDK funnel metrics, scoped by publishable key and served from the columnar store only. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SdkEventAnalyticsService {

    private final AnalyticsProvider provider;
    private final MetricsFanout fanout;
    private final AnalyticsTelemetry telemetry;

    public MetricsResponse<SdkEventMetricsBucketResponse> getMetrics(
            AnalyticsScope scope, GetSdkEventMetricRequest request) {
        Objects.requireNonNull(request, "metrics request");
        if (scope == null || !scope.hasPublishableKey()) {
            log.debug("No publishable key in scope, returning empty SDK event metrics");
            return MetricsResponse.empty(request.timeRange());
        }
        if (request.metrics().isEmpty()) {
            throw new IllegalArgumentException("At least one SDK event metric is required");
        }

        List<MetricTask<Map<SdkEventMetricsBucketIdentifier, SdkEventMetricsAccumulator>>> tasks = new ArrayList<>();
        for (SdkEventMetrics metric : request.metrics()) {
            tasks.add(new MetricTask<>(metric.metricName(), () -> {
                List<MetricBucket<SdkEventMetricsBucketIdentifier, SdkEventMetricRow>> buckets = provider.loadColumnar(
                        AnalyticsDomain.SDK_EVENTS,
                        metric.metricName(),
                        dataSource -> metric.loadMetrics(
                                request.groupByNames(),
                                scope,
                                request.filters(),
                                request.granularity(),
                                request.timeRange(),
                                dataSource));
                telemetry.recordRowsLoaded(AnalyticsDomain.SDK_EVENTS, metric.metricName(), buckets.size());
                log.debug("Loaded SDK event metric={} rows={}", metric.metricName(), buckets.size());
                return BucketMerge.into(
                        buckets,
                        bucket -> new SdkEventMetricsAccumulator(),
                        (accumulator, row) -> accumulator.add(metric, row));
            }));
        }

        Map<SdkEventMetricsBucketIdentifier, SdkEventMetricsAccumulator> accumulators = new HashMap<>();
        fanout.run(tasks, accumulators);

        List<SdkEventMetricsBucketResponse> data = accumulators.entrySet().stream()
                .map(e -> new SdkEventMetricsBucketResponse(e.getValue().collect(), e.getKey()))
                .toList();
        return MetricsResponse.of(data, request.timeRange());
    }
}
