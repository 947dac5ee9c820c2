package com.paylens.service.core.disputes;

import java.math.BigDecimal;

public record DisputeMetricsBucketValue(
        Long disputesChallenged,
        Long disputesWon,
        Long disputesLost,
        Long totalDispute,
        BigDecimal totalAmountDisputed,
        BigDecimal totalDisputeLostAmount) {}
