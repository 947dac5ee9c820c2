package com.paylens.service.core.telemetry;

import com.paylens.service.core.model.AnalyticsDomain;
import java.time.Duration;

public interface AnalyticsTelemetry {
    void recordFetchTime(AnalyticsDomain domain, String metric, String source, Duration elapsed);

    void recordRowsLoaded(AnalyticsDomain domain, String metric, int rows);

    void recordShadowMismatch(AnalyticsDomain domain, String metric);
}
