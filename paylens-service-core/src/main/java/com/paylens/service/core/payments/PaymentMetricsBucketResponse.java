package com.paylens.service.core.payments;

public record PaymentMetricsBucketResponse(
        PaymentMetricsBucketValue values, PaymentMetricsBucketIdentifier dimensions) {}
