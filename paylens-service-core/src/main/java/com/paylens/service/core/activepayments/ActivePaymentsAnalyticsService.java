package com.paylens.service.core.activepayments;

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
public class ActivePaymentsAnalyticsService {

    private final AnalyticsProvider provider;
    private final MetricsFanout fanout;
    private final AnalyticsTelemetry telemetry;

    public MetricsResponse<ActivePaymentsMetricsBucketResponse> getMetrics(
            AnalyticsScope scope, GetActivePaymentsMetricRequest request) {
        Objects.requireNonNull(request, "metrics request");
        if (scope == null || !scope.hasPublishableKey()) {
            log.debug("No publishable key in scope, returning empty active payments metrics");
            return MetricsResponse.empty(request.timeRange());
        }
        if (request.metrics().isEmpty()) {
            throw new IllegalArgumentException("At least one active payments metric is required");
        }

        List<MetricTask<Map<ActivePaymentsMetricsBucketIdentifier, ActivePaymentsMetricsAccumulator>>> tasks =
                new ArrayList<>();
        for (ActivePaymentsMetrics metric : request.metrics()) {
            tasks.add(new MetricTask<>(metric.metricName(), () -> {
                List<MetricBucket<ActivePaymentsMetricsBucketIdentifier, ActivePaymentsMetricRow>> buckets =
                        provider.loadColumnar(
                                AnalyticsDomain.ACTIVE_PAYMENTS,
                                metric.metricName(),
                                dataSource -> metric.loadMetrics(scope, request.timeRange(), dataSource));
                telemetry.recordRowsLoaded(AnalyticsDomain.ACTIVE_PAYMENTS, metric.metricName(), buckets.size());
                log.debug("Loaded active payments metric={} rows={}", metric.metricName(), buckets.size());
                return BucketMerge.into(
                        buckets,
                        bucket -> new ActivePaymentsMetricsAccumulator(),
                        (accumulator, row) -> accumulator.add(metric, row));
            }));
        }

        Map<ActivePaymentsMetricsBucketIdentifier, ActivePaymentsMetricsAccumulator> accumulators = new HashMap<>();
        fanout.run(tasks, accumulators);

        List<ActivePaymentsMetricsBucketResponse> data = accumulators.entrySet().stream()
                .map(e -> new ActivePaymentsMetricsBucketResponse(e.getValue().collect(), e.getKey()))
                .toList();
        return MetricsResponse.of(data, request.timeRange());
    }
}
