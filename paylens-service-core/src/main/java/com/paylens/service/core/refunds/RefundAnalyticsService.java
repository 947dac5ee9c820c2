package com.paylens.service.core.refunds;

import com.paylens.service.core.fanout.MetricTask;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.metrics.BucketMerge;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsDomain;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.Distribution;
import com.paylens.service.core.model.DistributionCardinality;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.refunds.distribution.RefundDistributionRow;
import com.paylens.service.core.refunds.distribution.RefundDistributions;
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
public class RefundAnalyticsService {

    private final AnalyticsProvider provider;
    private final MetricsFanout fanout;
    private final AnalyticsTelemetry telemetry;

    public MetricsResponse<RefundMetricsBucketResponse> getMetrics(AnalyticsScope scope, GetRefundMetricRequest request) {
        Objects.requireNonNull(request, "metrics request");
        if (scope == null || !scope.hasMerchant()) {
            log.debug("No merchant in scope, returning empty refund metrics");
            return MetricsResponse.empty(request.timeRange());
        }
        if (request.metrics().isEmpty()) {
            throw new IllegalArgumentException("At least one refund metric is required");
        }

        Distribution<RefundDistributions> distribution = request.distribution();
        int distributionLimit = distribution != null
                ? distribution.cardinality().limit()
                : DistributionCardinality.TOP_5.limit();

        List<MetricTask<Map<RefundMetricsBucketIdentifier, RefundMetricsAccumulator>>> tasks = new ArrayList<>();
        for (RefundMetrics metric : request.metrics()) {
            tasks.add(new MetricTask<>(metric.metricName(), () -> {
                List<MetricBucket<RefundMetricsBucketIdentifier, RefundMetricRow>> buckets = provider.load(
                        AnalyticsDomain.REFUNDS,
                        metric.metricName(),
                        dataSource -> metric.loadMetrics(
                                request.groupByNames(),
                                scope,
                                request.filters(),
                                request.granularity(),
                                request.timeRange(),
                                dataSource));
                loaded(metric.metricName(), buckets.size());
                return BucketMerge.into(
                        buckets,
                        bucket -> new RefundMetricsAccumulator(distributionLimit),
                        (accumulator, row) -> accumulator.add(metric, row));
            }));
        }
        if (distribution != null) {
            RefundDistributions distributionFor = distribution.distributionFor();
            tasks.add(new MetricTask<>(distributionFor.metricName(), () -> {
                List<MetricBucket<RefundMetricsBucketIdentifier, RefundDistributionRow>> buckets = provider.load(
                        AnalyticsDomain.REFUNDS,
                        distributionFor.metricName(),
                        dataSource -> distributionFor.loadDistribution(
                                request.groupByNames(),
                                scope,
                                request.filters(),
                                request.granularity(),
                                request.timeRange(),
                                dataSource));
                loaded(distributionFor.metricName(), buckets.size());
                return BucketMerge.into(
                        buckets,
                        bucket -> new RefundMetricsAccumulator(distributionLimit),
                        (accumulator, row) -> accumulator.add(distributionFor, row));
            }));
        }

        Map<RefundMetricsBucketIdentifier, RefundMetricsAccumulator> accumulators = new HashMap<>();
        fanout.run(tasks, accumulators);

        List<RefundMetricsBucketResponse> data = accumulators.entrySet().stream()
                .map(e -> new RefundMetricsBucketResponse(e.getValue().collect(), e.getKey()))
                .toList();
        return MetricsResponse.of(data, request.timeRange());
    }

    private void loaded(String metric, int rows) {
        telemetry.recordRowsLoaded(AnalyticsDomain.REFUNDS, metric, rows);
        log.debug("Loaded refund metric={} rows={}", metric, rows);
    }
}
