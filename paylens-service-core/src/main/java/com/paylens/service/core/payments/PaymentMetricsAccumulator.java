package com.paylens.service.core.payments;

import com.paylens.service.core.accumulator.AverageAccumulator;
import com.paylens.service.core.accumulator.CountAccumulator;
import com.paylens.service.core.accumulator.DistributionAccumulator;
import com.paylens.service.core.accumulator.SuccessRateAccumulator;
import com.paylens.service.core.accumulator.SumAccumulator;
import com.paylens.service.core.payments.distribution.PaymentDistributionRow;
import com.paylens.service.core.payments.distribution.PaymentDistributions;

/** Per-bucket accumulators of every payment metric. */
public class PaymentMetricsAccumulator {

    private final SuccessRateAccumulator successRate = new SuccessRateAccumulator();
    private final CountAccumulator paymentCount = new CountAccumulator();
    private final CountAccumulator successCount = new CountAccumulator();
    private final SumAccumulator processedAmount = new SumAccumulator();
    private final AverageAccumulator avgTicketSize = new AverageAccumulator();
    private final CountAccumulator retriesCount = new CountAccumulator();
    private final DistributionAccumulator errorMessage;

    public PaymentMetricsAccumulator(int distributionLimit) {
        this.errorMessage = new DistributionAccumulator(distributionLimit);
    }

    public void add(PaymentMetrics metric, PaymentMetricRow row) {
        switch (metric) {
            case PAYMENT_SUCCESS_RATE -> successRate.add(
                    new SuccessRateAccumulator.Outcome(row.status() == AttemptStatus.CHARGED, row.count()));
            case PAYMENT_COUNT -> paymentCount.add(row.count());
            case PAYMENT_SUCCESS_COUNT -> successCount.add(row.count());
            case PAYMENT_PROCESSED_AMOUNT -> processedAmount.add(row.total());
            case AVG_TICKET_SIZE -> avgTicketSize.add(new AverageAccumulator.Sample(row.total(), row.count()));
            case RETRIES_COUNT -> retriesCount.add(row.count());
        }
    }

    public void add(PaymentDistributions distribution, PaymentDistributionRow row) {
        switch (distribution) {
            case PAYMENT_ERROR_MESSAGE -> errorMessage.add(
                    new DistributionAccumulator.Entry(row.errorMessage(), row.count()));
        }
    }

    public PaymentMetricsBucketValue collect() {
        return new PaymentMetricsBucketValue(
                successRate.collect(),
                paymentCount.collect(),
                successCount.collect(),
                processedAmount.collect(),
                avgTicketSize.collect(),
                retriesCount.collect(),
                errorMessage.collect());
    }
}
