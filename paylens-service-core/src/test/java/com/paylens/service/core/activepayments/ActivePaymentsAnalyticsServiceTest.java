package com.paylens.service.core.activepayments;

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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ActivePaymentsAnalyticsServiceTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void countsDistinctPaymentsSinceTheRangeStart() {
        FakeDataSource clickhouse = FakeDataSource.returning("clickhouse", List.of(Map.of("count", "17")));
        NoopAnalyticsTelemetry telemetry = new NoopAnalyticsTelemetry();
        ActivePaymentsAnalyticsService service = new ActivePaymentsAnalyticsService(
                AnalyticsProvider.clickhouse(clickhouse, telemetry), new MetricsFanout(executor), telemetry);
        TimeRange range = TimeRange.since(Instant.parse("2024-05-01T12:00:00Z"));

        MetricsResponse<ActivePaymentsMetricsBucketResponse> response = service.getMetrics(
                AnalyticsScope.publishableKey("pk_1"),
                new GetActivePaymentsMetricRequest(range, Set.of(ActivePaymentsMetrics.ACTIVE_PAYMENTS)));

        assertThat(response.queryData()).hasSize(1);
        assertThat(response.queryData().get(0).values().activePayments()).isEqualTo(17L);
        assertThat(response.queryData().get(0).dimensions().timeBucket()).isEqualTo(range);
        assertThat(clickhouse.queries())
                .singleElement()
                .asString()
                .contains("count(distinct payment_id) as count")
                .contains("FROM active_payments")
                .contains("publishable_key = 'pk_1'")
                .contains("created_at >= '2024-05-01T12:00:00Z'")
                .doesNotContain("<=");
    }
}
