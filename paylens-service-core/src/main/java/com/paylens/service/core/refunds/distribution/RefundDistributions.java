package com.paylens.service.core.refunds.distribution;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.refunds.RefundDimensions;
import com.paylens.service.core.refunds.RefundFilters;
import com.paylens.service.core.refunds.RefundMetricsBucketIdentifier;
import com.paylens.service.core.refunds.RefundQueries;
import java.util.List;
import java.util.Locale;

public enum RefundDistributions {
    REFUND_REASON("refund_reason");

    private final String column;

    RefundDistributions(String column) {
        this.column = column;
    }

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Refund counts per value of this distribution's column, leaving out rows where it is unset. */
    public List<MetricBucket<RefundMetricsBucketIdentifier, RefundDistributionRow>> loadDistribution(
            List<RefundDimensions> dimensions,
            AnalyticsScope scope,
            RefundFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        List<RefundDistributionRow> rows = MetricQueries.execute(
                () -> RefundQueries.refunds(dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(column)
                        .addSelectColumn(Aggregate.count("count"))
                        .addNotNullClause(column)
                        .addGroupByClause(column),
                RefundDistributionRow.LOADER);
        return RefundQueries.bucketed(rows, granularity, timeRange);
    }
}
