package com.paylens.service.core.activepayments;

public record ActivePaymentsMetricsBucketResponse(
        ActivePaymentsMetricsBucketValue values, ActivePaymentsMetricsBucketIdentifier dimensions) {}
