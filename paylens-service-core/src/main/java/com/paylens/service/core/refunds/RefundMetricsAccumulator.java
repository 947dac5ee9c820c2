package com.paylens.service.core.refunds;

import com.paylens.service.core.accumulator.CountAccumulator;
import com.paylens.service.core.accumulator.DistributionAccumulator;
import com.paylens.service.core.accumulator.SuccessRateAccumulator;
import com.paylens.service.core.accumulator.SumAccumulator;
import com.paylens.service.core.refunds.distribution.RefundDistributionRow;
import com.paylens.service.core.refunds.distribution.RefundDistributions;

public class RefundMetricsAccumulator {

    private final SuccessRateAccumulator successRate = new SuccessRateAccumulator();
    private final CountAccumulator refundCount = new CountAccumulator();
    private final CountAccumulator successCount = new CountAccumulator();
    private final SumAccumulator processedAmount = new SumAccumulator();
    private final DistributionAccumulator refundReason;

    public RefundMetricsAccumulator(int distributionLimit) {
        this.refundReason = new DistributionAccumulator(distributionLimit);
    }

    public void add(RefundMetrics metric, RefundMetricRow row) {
        switch (metric) {
            case REFUND_SUCCESS_RATE -> successRate.add(
                    new SuccessRateAccumulator.Outcome(row.refundStatus() == RefundStatus.SUCCESS, row.count()));
            case REFUND_COUNT -> refundCount.add(row.count());
            case REFUND_SUCCESS_COUNT -> successCount.add(row.count());
            case REFUND_PROCESSED_AMOUNT -> processedAmount.add(row.total());
        }
    }

    public void add(RefundDistributions distribution, RefundDistributionRow row) {
        switch (distribution) {
            case REFUND_REASON -> refundReason.add(new DistributionAccumulator.Entry(row.refundReason(), row.count()));
        }
    }

    public RefundMetricsBucketValue collect() {
        return new RefundMetricsBucketValue(
                successRate.collect(),
                refundCount.collect(),
                successCount.collect(),
                processedAmount.collect(),
                refundReason.collect());
    }
}
