package com.paylens.service.core.apievents.metrics;

import com.paylens.service.core.apievents.ApiEventDimensions;
import com.paylens.service.core.apievents.ApiEventFilters;
import com.paylens.service.core.apievents.ApiEventMetric;
import com.paylens.service.core.apievents.ApiEventMetricRow;
import com.paylens.service.core.apievents.ApiEventMetricsBucketIdentifier;
import com.paylens.service.core.apievents.ApiEventQueries;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import java.util.List;

/** Number of API calls that recorded a response status code. */
public class StatusCodeCount implements ApiEventMetric {

    @Override
    public List<MetricBucket<ApiEventMetricsBucketIdentifier, ApiEventMetricRow>> loadMetrics(
            List<ApiEventDimensions> dimensions,
            AnalyticsScope scope,
            ApiEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource) {
        List<ApiEventMetricRow> rows = MetricQueries.execute(
                () -> ApiEventQueries.events(dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(Aggregate.count(ApiEventDimensions.STATUS_CODE.column(), "count")),
                ApiEventMetricRow.LOADER);
        return ApiEventQueries.bucketed(rows, granularity, timeRange);
    }
}
