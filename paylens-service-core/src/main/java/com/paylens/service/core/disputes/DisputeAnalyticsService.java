package com.paylens.service.core.disputes;

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
public class DisputeAnalyticsService {

    private final AnalyticsProvider provider;
    private final MetricsFanout fanout;
    private final AnalyticsTelemetry telemetry;

    public MetricsResponse<DisputeMetricsBucketResponse> getMetrics(
            AnalyticsScope scope, GetDisputeMetricRequest request) {
        Objects.requireNonNull(request, "metrics request");
        if (scope == null || !scope.hasMerchant()) {
            log.debug("No merchant in scope, returning empty dispute metrics");
            return MetricsResponse.empty(request.timeRange());
        }
        if (request.metrics().isEmpty()) {
            throw new IllegalArgumentException("At least one dispute metric is required");
        }

        List<MetricTask<Map<DisputeMetricsBucketIdentifier, DisputeMetricsAccumulator>>> tasks = new ArrayList<>();
        for (DisputeMetrics metric : request.metrics()) {
            tasks.add(new MetricTask<>(metric.metricName(), () -> {
                List<MetricBucket<DisputeMetricsBucketIdentifier, DisputeMetricRow>> buckets = provider.load(
                        AnalyticsDomain.DISPUTES,
                        metric.metricName(),
                        dataSource -> metric.loadMetrics(
                                request.groupByNames(),
                                scope,
                                request.filters(),
                                request.granularity(),
                                request.timeRange(),
                                dataSource));
                telemetry.recordRowsLoaded(AnalyticsDomain.DISPUTES, metric.metricName(), buckets.size());
                log.debug("Loaded dispute metric={} rows={}", metric.metricName(), buckets.size());
                return BucketMerge.into(
                        buckets,
                        bucket -> new DisputeMetricsAccumulator(),
                        (accumulator, row) -> accumulator.add(metric, row));
            }));
        }

        Map<DisputeMetricsBucketIdentifier, DisputeMetricsAccumulator> accumulators = new HashMap<>();
        fanout.run(tasks, accumulators);

        List<DisputeMetricsBucketResponse> data = accumulators.entrySet().stream()
                .map(e -> new DisputeMetricsBucketResponse(e.getValue().collect(), e.getKey()))
                .toList();
        return MetricsResponse.of(data, request.timeRange());
    }
}
