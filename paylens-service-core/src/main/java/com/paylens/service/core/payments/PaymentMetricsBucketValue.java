package com.paylens.service.core.payments;

import com.paylens.service.core.model.DistributionEntry;
import java.math.BigDecimal;
import java.util.List;

/** Collected values of one bucket. A metric that was not requested, or had no rows, stays {@code null}. */
public record PaymentMetricsBucketValue(
        Double paymentSuccessRate,
        Long paymentCount,
        Long paymentSuccessCount,
        BigDecimal paymentProcessedAmount,
        Double avgTicketSize,
        Long retriesCount,
        List<DistributionEntry> paymentErrorMessage) {}
