package com.paylens.service.core.disputes;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.disputes.metrics.DisputeStatusMetric;
import com.paylens.service.core.disputes.metrics.TotalAmountDisputed;
import com.paylens.service.core.disputes.metrics.TotalDisputeLostAmount;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;
import java.util.Locale;

public enum DisputeMetrics implements DisputeMetric {
    DISPUTE_STATUS_METRIC,
    TOTAL_AMOUNT_DISPUTED,
    TOTAL_DISPUTE_LOST_AMOUNT;

    private static final DisputeMetric STATUS = new DisputeStatusMetric();
    private static final DisputeMetric AMOUNT_DISPUTED = new TotalAmountDisputed();
    private static final DisputeMetric LOST_AMOUNT = new TotalDisputeLostAmount();

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<MetricBucket<DisputeMetricsBucketIdentifier, DisputeMetricRow>> loadMetrics(
            List<DisputeDimensions> dimensions,
            AnalyticsScope scope,
            DisputeFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        DisputeMetric metric = switch (this) {
            case DISPUTE_STATUS_METRIC -> STATUS;
            case TOTAL_AMOUNT_DISPUTED -> AMOUNT_DISPUTED;
            case TOTAL_DISPUTE_LOST_AMOUNT -> LOST_AMOUNT;
        };
        return metric.loadMetrics(dimensions, scope, filters, granularity, timeRange, dataSource);
    }
}
