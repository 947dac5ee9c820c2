package com.paylens.service.core.payments;

import com.paylens.service.core.fanout.MetricTask;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.metrics.BucketMerge;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsDomain;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.Distribution;
import com.paylens.service.core.model.DistributionCardinality;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.payments.distribution.PaymentDistributionRow;
import com.paylens.service.core.payments.distribution.PaymentDistributions;
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
public class PaymentAnalyticsService {

    private final AnalyticsProvider provider;
    private final MetricsFanout fanout;
    private final AnalyticsTelemetry telemetry;

    public MetricsResponse<PaymentMetricsBucketResponse> getMetrics(
            AnalyticsScope scope, GetPaymentMetricRequest request) {
        Objects.requireNonNull(request, "metrics request");
        if (scope == null || !scope.hasMerchant()) {
            log.debug("No merchant in scope, returning empty payment metrics");
            return MetricsResponse.empty(request.timeRange());
        }
        if (request.metrics().isEmpty()) {
            throw new IllegalArgumentException("At least one payment metric is required");
        }

        Distribution<PaymentDistributions> distribution = request.distribution();
        int distributionLimit = distribution != null
                ? distribution.cardinality().limit()
                : DistributionCardinality.TOP_5.limit();

        List<MetricTask<Map<PaymentMetricsBucketIdentifier, PaymentMetricsAccumulator>>> tasks = new ArrayList<>();
        for (PaymentMetrics metric : request.metrics()) {
            tasks.add(new MetricTask<>(metric.metricName(), () -> {
                List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentMetricRow>> buckets = provider.load(
                        AnalyticsDomain.PAYMENTS,
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
                        bucket -> new PaymentMetricsAccumulator(distributionLimit),
                        (accumulator, row) -> accumulator.add(metric, row));
            }));
        }
        if (distribution != null) {
            PaymentDistributions distributionFor = distribution.distributionFor();
            tasks.add(new MetricTask<>(distributionFor.metricName(), () -> {
                List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentDistributionRow>> buckets = provider.load(
                        AnalyticsDomain.PAYMENTS,
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
                        bucket -> new PaymentMetricsAccumulator(distributionLimit),
                        (accumulator, row) -> accumulator.add(distributionFor, row));
            }));
        }

        Map<PaymentMetricsBucketIdentifier, PaymentMetricsAccumulator> accumulators = new HashMap<>();
        fanout.run(tasks, accumulators);

        List<PaymentMetricsBucketResponse> data = accumulators.entrySet().stream()
                .map(e -> new PaymentMetricsBucketResponse(e.getValue().collect(), e.getKey()))
                .toList();
        return MetricsResponse.of(data, request.timeRange());
    }

    private void loaded(String metric, int rows) {
        telemetry.recordRowsLoaded(AnalyticsDomain.PAYMENTS, metric, rows);
        log.debug("Loaded payment metric={} rows={}", metric, rows);
    }
}
