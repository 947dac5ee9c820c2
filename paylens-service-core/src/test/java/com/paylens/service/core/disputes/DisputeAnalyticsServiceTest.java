package com.paylens.service.core.disputes;

import static org.assertj.core.api.Assertions.assertThat;

import com.paylens.service.core.backend.FakeDataSource;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.telemetry.NoopAnalyticsTelemetry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DisputeAnalyticsServiceTest {

    private static final TimeRange WEEK =
            TimeRange.of(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-08T00:00:00Z"));

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void statusCountsAndAmountsLandInTheSameBucket() {
        FakeDataSource store = new FakeDataSource("postgres", query -> {
            if (query.contains("GROUP BY dispute_status")) {
                return List.of(
                        Map.of("dispute_status", "dispute_won", "count", 2),
                        Map.of("dispute_status", "dispute_lost", "count", 1),
                        Map.of("dispute_status", "dispute_opened", "count", 3));
            }
            if (query.contains("'dispute_lost'")) {
                return List.of(Map.of("total", "40.00"));
            }
            return List.of(Map.of("total", "250.50"));
        });
        NoopAnalyticsTelemetry telemetry = new NoopAnalyticsTelemetry();
        DisputeAnalyticsService service = new DisputeAnalyticsService(
                AnalyticsProvider.sqlx(store, telemetry), new MetricsFanout(executor), telemetry);
        GetDisputeMetricRequest request = new GetDisputeMetricRequest(
                WEEK,
                List.of(),
                DisputeFilters.none(),
                Set.of(DisputeMetrics.values()),
                null);

        MetricsResponse<DisputeMetricsBucketResponse> response =
                service.getMetrics(AnalyticsScope.merchant("m1"), request);

        assertThat(response.queryData()).hasSize(1);
        DisputeMetricsBucketValue values = response.queryData().get(0).values();
        assertThat(values.disputesChallenged()).isNull();
        assertThat(values.disputesWon()).isEqualTo(2L);
        assertThat(values.disputesLost()).isEqualTo(1L);
        assertThat(values.totalDispute()).isEqualTo(6L);
        assertThat(values.totalAmountDisputed()).isEqualByComparingTo(new BigDecimal("250.50"));
        assertThat(values.totalDisputeLostAmount()).isEqualByComparingTo(new BigDecimal("40"));
        assertThat(response.queryData().get(0).dimensions().timeBucket()).isEqualTo(WEEK);
        assertThat(store.queries()).hasSize(3).allSatisfy(q -> assertThat(q).contains("FROM dispute"));
    }
}
