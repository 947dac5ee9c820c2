package com.paylens.service.core.refunds;

import static org.assertj.core.api.Assertions.assertThat;

import com.paylens.service.core.backend.FakeDataSource;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.Distribution;
import com.paylens.service.core.model.DistributionEntry;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.refunds.distribution.RefundDistributions;
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

class RefundAnalyticsServiceTest {

    private static final TimeRange DAY =
            TimeRange.of(Instant.parse("2024-02-01T00:00:00Z"), Instant.parse("2024-02-02T00:00:00Z"));

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void successRateAndReasonsAreSplitPerCurrency() {
        FakeDataSource store = new FakeDataSource("postgres", query -> {
            if (query.contains("refund_reason")) {
                return List.of(
                        Map.of("currency", "USD", "refund_reason", "duplicate", "count", 3),
                        Map.of("currency", "EUR", "refund_reason", "fraud", "count", 1));
            }
            return List.of(
                    Map.of("currency", "USD", "refund_status", "success", "count", 2),
                    Map.of("currency", "USD", "refund_status", "failure", "count", 2),
                    Map.of("currency", "EUR", "refund_status", "success", "count", 1));
        });
        NoopAnalyticsTelemetry telemetry = new NoopAnalyticsTelemetry();
        RefundAnalyticsService service = new RefundAnalyticsService(
                AnalyticsProvider.sqlx(store, telemetry), new MetricsFanout(executor), telemetry);
        GetRefundMetricRequest request = new GetRefundMetricRequest(
                DAY,
                List.of(RefundDimensions.CURRENCY),
                null,
                Set.of(RefundMetrics.REFUND_SUCCESS_RATE),
                null,
                new Distribution<>(RefundDistributions.REFUND_REASON, null));

        MetricsResponse<RefundMetricsBucketResponse> response =
                service.getMetrics(AnalyticsScope.merchant("m1"), request);

        Map<String, RefundMetricsBucketValue> byCurrency = response.queryData().stream()
                .collect(Collectors.toMap(b -> b.dimensions().currency(), RefundMetricsBucketResponse::values));
        assertThat(byCurrency).containsOnlyKeys("USD", "EUR");
        assertThat(byCurrency.get("USD").refundSuccessRate()).isEqualTo(50.0d);
        assertThat(byCurrency.get("USD").refundReason())
                .containsExactly(new DistributionEntry("duplicate", 3L, 100.0d));
        assertThat(byCurrency.get("EUR").refundSuccessRate()).isEqualTo(100.0d);
        assertThat(byCurrency.get("EUR").refundCount()).isNull();
        assertThat(response.queryData())
                .extracting(b -> b.dimensions().refundStatus())
                .containsOnlyNulls();
        assertThat(store.queries())
                .anySatisfy(q -> assertThat(q).contains("GROUP BY currency, refund_status"))
                .anySatisfy(q -> assertThat(q).contains("refund_reason IS NOT NULL"));
    }
}
