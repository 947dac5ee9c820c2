package com.paylens.service.core.activepayments;

import com.paylens.service.core.accumulator.CountAccumulator;

public class ActivePaymentsMetricsAccumulator {

    private final CountAccumulator activePayments = new CountAccumulator();

    public void add(ActivePaymentsMetrics metric, ActivePaymentsMetricRow row) {
        switch (metric) {
            case ACTIVE_PAYMENTS -> activePayments.add(row.count());
        }
    }

    public ActivePaymentsMetricsBucketValue collect() {
        return new ActivePaymentsMetricsBucketValue(activePayments.collect());
    }
}
