package com.paylens.service.core.apievents;

public record ApiEventMetricsBucketValue(Double latency, Long apiCount, Long statusCodeCount) {}
