package com.paylens.service.core.refunds;

import com.paylens.service.core.model.DistributionEntry;
import java.math.BigDecimal;
import java.util.List;

public record RefundMetricsBucketValue(
        Double refundSuccessRate,
        Long refundCount,
        Long refundSuccessCount,
        BigDecimal refundProcessedAmount,
        List<DistributionEntry> refundReason) {}
