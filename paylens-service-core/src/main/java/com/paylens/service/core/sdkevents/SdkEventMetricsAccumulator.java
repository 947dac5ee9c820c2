package com.paylens.service.core.sdkevents;

import com.paylens.service.core.accumulator.AverageAccumulator;
import com.paylens.service.core.accumulator.CountAccumulator;

public class SdkEventMetricsAccumulator {

    private final CountAccumulator paymentAttempts = new CountAccumulator();
    private final CountAccumulator rendered = new CountAccumulator();
    private final CountAccumulator initiated = new CountAccumulator();
    private final CountAccumulator methodSelected = new CountAccumulator();
    private final CountAccumulator dataFilled = new CountAccumulator();
    private final AverageAccumulator paymentTime = new AverageAccumulator();

    public void add(SdkEventMetrics metric, SdkEventMetricRow row) {
        switch (metric) {
            case PAYMENT_ATTEMPTS -> paymentAttempts.add(row.count());
            case SDK_RENDERED_COUNT -> rendered.add(row.count());
            case SDK_INITIATED_COUNT -> initiated.add(row.count());
            case PAYMENT_METHOD_SELECTED_COUNT -> methodSelected.add(row.count());
            case PAYMENT_DATA_FILLED_COUNT -> dataFilled.add(row.count());
            case AVERAGE_PAYMENT_TIME -> paymentTime.add(new AverageAccumulator.Sample(row.total(), row.count()));
        }
    }

    public SdkEventMetricsBucketValue collect() {
        return new SdkEventMetricsBucketValue(
                paymentAttempts.collect(),
                rendered.collect(),
                initiated.collect(),
                methodSelected.collect(),
                dataFilled.collect(),
                paymentTime.collect());
    }
}
