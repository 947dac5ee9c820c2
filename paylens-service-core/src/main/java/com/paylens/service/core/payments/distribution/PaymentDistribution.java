package com.paylens.service.core.payments.distribution;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.payments.PaymentDimensions;
import com.paylens.service.core.payments.PaymentFilters;
import com.paylens.service.core.payments.PaymentMetricsBucketIdentifier;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

public interface PaymentDistribution {
    List<MetricBucket<PaymentMetricsBucketIdentifier, PaymentDistributionRow>> loadDistribution(
            List<PaymentDimensions> dimensions,
            AnalyticsScope scope,
            PaymentFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource);
}
