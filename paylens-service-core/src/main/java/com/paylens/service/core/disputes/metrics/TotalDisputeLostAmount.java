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
import com.paylens.service.core.disputes.DisputeStatus;
import com.paylens.service.core.query.QueryValue;
import java.util.List;

public class TotalDisputeLostAmount implements DisputeMetric {

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
                        .addSelectColumn(Aggregate.sum(DisputeQueries.AMOUNT_COLUMN, "total"))
                        .addFilterClause(DisputeQueries.STATUS_COLUMN, QueryValue.of(DisputeStatus.DISPUTE_LOST)),
                DisputeMetricRow.LOADER);
        return DisputeQueries.bucketed(rows, granularity, timeRange);
    }
}
