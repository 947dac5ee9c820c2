package com.paylens.service.core.telemetry;

import com.paylens.service.core.model.AnalyticsDomain;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class AnalyticsTelemetryRegistry implements AnalyticsTelemetry {
    private final Map<FetchKey, FetchStats> fetches = new ConcurrentHashMap<>();
    private final Map<MetricKey, LongAdder> rowsLoaded = new ConcurrentHashMap<>();
    private final LongAdder shadowMismatches = new LongAdder();

    @Override
    public void recordFetchTime(AnalyticsDomain domain, String metric, String source, Duration elapsed) {
        FetchStats stats = fetches.computeIfAbsent(new FetchKey(domain, metric, source), key -> new FetchStats());
        stats.calls.increment();
        if (elapsed != null) {
            stats.millis.add(elapsed.toMillis());
        }
    }

    @Override
    public void recordRowsLoaded(AnalyticsDomain domain, String metric, int rows) {
        if (rows <= 0) {
            return;
        }
        rowsLoaded.computeIfAbsent(new MetricKey(domain, metric), key -> new LongAdder()).add(rows);
    }

    @Override
    public void recordShadowMismatch(AnalyticsDomain domain, String metric) {
        shadowMismatches.increment();
    }

    public Snapshot snapshot() {
        Map<FetchKey, FetchTotals> fetchTotals = fetches.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> new FetchTotals(e.getValue().calls.sum(), e.getValue().millis.sum())));
        Map<MetricKey, Long> rows = rowsLoaded.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().sum()));
        return new Snapshot(fetchTotals, rows, shadowMismatches.sum());
    }

    public record Snapshot(Map<FetchKey, FetchTotals> fetches, Map<MetricKey, Long> rowsLoaded, long shadowMismatches) {}

    public record FetchKey(AnalyticsDomain domain, String metric, String source) {}

    public record MetricKey(AnalyticsDomain domain, String metric) {}

    public record FetchTotals(long calls, long totalMillis) {}

    private static final class FetchStats {
        private final LongAdder calls = new LongAdder();
        private final LongAdder millis = new LongAdder();
    }
}
