package com.paylens.service.core.disputes;

import com.paylens.service.core.accumulator.SumAccumulator;

public class DisputeMetricsAccumulator {

    private final DisputeStatusAccumulator status = new DisputeStatusAccumulator();
    private final SumAccumulator amountDisputed = new SumAccumulator();
    private final SumAccumulator lostAmount = new SumAccumulator();

    public void add(DisputeMetrics metric, DisputeMetricRow row) {
        switch (metric) {
            case DISPUTE_STATUS_METRIC -> status.add(
                    new DisputeStatusAccumulator.StatusCount(row.disputeStatus(), row.count()));
            case TOTAL_AMOUNT_DISPUTED -> amountDisputed.add(row.total());
            case TOTAL_DISPUTE_LOST_AMOUNT -> lostAmount.add(row.total());
        }
    }

    public DisputeMetricsBucketValue collect() {
        DisputeStatusAccumulator.Counts counts = status.collect();
        return new DisputeMetricsBucketValue(
                counts.challenged(),
                counts.won(),
                counts.lost(),
                counts.total(),
                amountDisputed.collect(),
                lostAmount.collect());
    }
}
