package com.paylens.service.core.telemetry;

import com.paylens.service.core.model.AnalyticsDomain;
import java.time.Duration;

public class NoopAnalyticsTelemetry implements AnalyticsTelemetry {
    @Override
    public void recordFetchTime(AnalyticsDomain domain, String metric, String source, Duration elapsed) {}

    @Override
    public void recordRowsLoaded(AnalyticsDomain domain, String metric, int rows) {}

    @Override
    public void recordShadowMismatch(AnalyticsDomain domain, String metric) {}
}
