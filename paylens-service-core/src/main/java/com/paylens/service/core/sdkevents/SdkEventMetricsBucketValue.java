package com.paylens.service.core.sdkevents;

public record SdkEventMetricsBucketValue(
        Long paymentAttempts,
        Long sdkRenderedCount,
        Long sdkInitiatedCount,
        Long paymentMethodSelectedCount,
        Long paymentDataFilledCount,
        Double averagePaymentTime) {}
