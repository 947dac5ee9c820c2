package com.paylens.service.core.apievents;

import static org.assertj.core.api.Assertions.assertThat;

import com.paylens.service.core.backend.FakeDataSource;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.telemetry.NoopAnalyticsTelemetry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ApiEventAnalyticsServiceTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void latencyAndCountsPerStatusCode() {
        FakeDataSource clickhouse = new FakeDataSource("clickhouse", query -> query.contains("latency")
                ? List.of(
                        Map.of("status_code", 200, "total", "300", "count", "3"),
                        Map.of("status_code", 500, "total", "50", "count", "1"))
                : List.of(
                        Map.of("status_code", 200, "count", "3"),
                        Map.of("status_code", 500, "count", "1")));
        NoopAnalyticsTelemetry telemetry = new NoopAnalyticsTelemetry();
        ApiEventAnalyticsService service = new ApiEventAnalyticsService(
                AnalyticsProvider.clickhouse(clickhouse, telemetry), new MetricsFanout(executor), telemetry);
        GetApiEventMetricRequest request = new GetApiEventMetricRequest(
                TimeRange.of(Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-02T00:00:00Z")),
                List.of(ApiEventDimensions.STATUS_CODE),
                new ApiEventFilters(List.of(200, 500), null, null),
                Set.of(ApiEventMetrics.LATENCY, ApiEventMetrics.API_COUNT),
                null);

        MetricsResponse<ApiEventMetricsBucketResponse> response =
                service.getMetrics(AnalyticsScope.merchant("m1"), request);

        Map<Integer, ApiEventMetricsBucketValue> byStatus = response.queryData().stream()
                .collect(Collectors.toMap(b -> b.dimensions().statusCode(), ApiEventMetricsBucketResponse::values));
        assertThat(byStatus).containsOnlyKeys(200, 500);
        assertThat(byStatus.get(200).latency()).isEqualTo(100.0d);
        assertThat(byStatus.get(200).apiCount()).isEqualTo(3L);
        assertThat(byStatus.get(500).latency()).isEqualTo(50.0d);
        assertThat(byStatus.get(500).statusCodeCount()).isNull();
        assertThat(clickhouse.queries())
                .hasSize(2)
                .allSatisfy(q -> assertThat(q)
                        .contains("FROM api_events")
                        .contains("merchant_id = 'm1'")
                        .contains("status_code IN (200, 500)"));
    }
}
