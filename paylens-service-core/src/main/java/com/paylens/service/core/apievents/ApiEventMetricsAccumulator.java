package com.paylens.service.core.apievents;

import com.paylens.service.core.accumulator.AverageAccumulator;
import com.paylens.service.core.accumulator.CountAccumulator;

public class ApiEventMetricsAccumulator {

    private final AverageAccumulator latency = new AverageAccumulator();
    private final CountAccumulator apiCount = new CountAccumulator();
    private final CountAccumulator statusCodeCount = new CountAccumulator();

    public void add(ApiEventMetrics metric, ApiEventMetricRow row) {
        switch (metric) {
            case LATENCY -> latency.add(new AverageAccumulator.Sample(row.total(), row.count()));
            case API_COUNT -> apiCount.add(row.count());
            case STATUS_CODE_COUNT -> statusCodeCount.add(row.count());
        }
    }

    public ApiEventMetricsBucketValue collect() {
        return new ApiEventMetricsBucketValue(latency.collect(), apiCount.collect(), statusCodeCount.collect());
    }
}
