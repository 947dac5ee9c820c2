package com.paylens.service.core.sdkevents;

public record SdkEventMetricsBucketResponse(
        SdkEventMetricsBucketValue values, SdkEventMetricsBucketIdentifier dimensions) {}
