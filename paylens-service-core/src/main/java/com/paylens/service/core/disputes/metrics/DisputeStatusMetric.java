package com.paylens.service.core.disputes.metrics;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.disputes.DisputeDimensions;
import com.paylens.service.core.disputes.DisputeFilters;
import com.paylens.service.core.disputes.DisputeMetric;
import com.paylens.service.core.disputes.DisputeMetricRow;
import com.paylens.service.core.disputes.DisputeMetricsBucketIdentifier;
import com.paylens.service.core.disputes.DisputeQueries;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** Dispute counts per status. The status is not a dimension and only routes counts on collection. */
public class DisputeStatusMetric implements DisputeMetric {

    @Override
    public List<MetricBucket<DisputeMetricsBucketIdentifier, DisputeMetricRow>> loadMetrics(
            List<DisputeDimensions> dimensions,
            AnalyticsScope scope,
            DisputeFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            AnalyticsDataSource dataSource) {
        List<DisputeMetricRow> rows = MetricQueries.execute(
                () -> DisputeQueries.disputes(dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(DisputeQueries.STATUS_COLUMN)
                        .addSelectColumn(Aggregate.count("count"))
                        .addGroupByClause(DisputeQueries.STATUS_COLUMN),
                DisputeMetricRow.LOADER);
        return DisputeQueries.bucketed(rows, granularity, timeRange);
    }
}
