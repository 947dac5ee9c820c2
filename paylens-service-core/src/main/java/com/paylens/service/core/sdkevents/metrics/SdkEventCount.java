package com.paylens.service.core.sdkevents.metrics;

import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.metrics.MetricQueries;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.sdkevents.SdkEventDimensions;
import com.paylens.service.core.sdkevents.SdkEventFilters;
import com.paylens.service.core.sdkevents.SdkEventMetric;
import com.paylens.service.core.sdkevents.SdkEventMetricRow;
import com.paylens.service.core.sdkevents.SdkEventMetricsBucketIdentifier;
import com.paylens.service.core.sdkevents.SdkEventName;
import com.paylens.service.core.sdkevents.SdkEventQueries;
import java.util.List;
import java.util.Objects;

/** Number of SDK events with one event name. */
public class SdkEventCount implements SdkEventMetric {

    private final SdkEventName eventName;

    public SdkEventCount(SdkEventName eventName) {
        this.eventName = Objects.requireNonNull(eventName, "eventName");
    }

    @Override
    public List<MetricBucket<SdkEventMetricsBucketIdentifier, SdkEventMetricRow>> loadMetrics(
            List<SdkEventDimensions> dimensions,
            AnalyticsScope scope,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            ColumnarDataSource dataSource) {
        List<SdkEventMetricRow> rows = MetricQueries.execute(
                () -> SdkEventQueries.events(
                                eventName, dimensions, scope, filters, granularity, timeRange, dataSource)
                        .addSelectColumn(Aggregate.count("count")),
                SdkEventMetricRow.LOADER);
        return SdkEventQueries.bucketed(rows, granularity, timeRange);
    }
}
