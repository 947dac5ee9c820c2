package com.paylens.service.core.refunds;

public record RefundMetricsBucketResponse(RefundMetricsBucketValue values, RefundMetricsBucketIdentifier dimensions) {}
