package com.paylens.service.core.disputes;

public record DisputeMetricsBucketResponse(
        DisputeMetricsBucketValue values, DisputeMetricsBucketIdentifier dimensions) {}
