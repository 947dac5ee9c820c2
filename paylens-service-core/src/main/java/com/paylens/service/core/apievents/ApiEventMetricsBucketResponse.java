package com.paylens.service.core.apievents;

public record ApiEventMetricsBucketResponse(
        ApiEventMetricsBucketValue values, ApiEventMetricsBucketIdentifier dimensions) {}
