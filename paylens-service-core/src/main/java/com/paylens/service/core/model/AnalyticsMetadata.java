package com.paylens.service.core.model;

import com.paylens.service.core.query.TimeRange;

public record AnalyticsMetadata(TimeRange currentTimeRange) {}
