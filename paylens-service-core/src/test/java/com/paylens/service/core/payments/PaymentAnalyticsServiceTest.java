package com.paylens.service.core.payments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.paylens.service.core.backend.FakeDataSource;
import com.paylens.service.core.error.MetricsErrorKind;
import com.paylens.service.core.error.MetricsException;
import com.paylens.service.core.fanout.MetricsFanout;
import com.paylens.service.core.model.AnalyticsMetadata;
import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.model.Distribution;
import com.paylens.service.core.model.DistributionCardinality;
import com.paylens.service.core.model.DistributionEntry;
import com.paylens.service.core.model.MetricsResponse;
import com.paylens.service.core.payments.distribution.PaymentDistributions;
import com.paylens.service.core.provider.AnalyticsProvider;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.TimeRange;
import com.paylens.service.core.telemetry.AnalyticsTelemetryRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PaymentAnalyticsServiceTest {

    private static final AnalyticsScope MERCHANT = AnalyticsScope.merchant("m1");
    private static final TimeRange DAY =
            TimeRange.of(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"));

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final AnalyticsTelemetryRegistry telemetry = new AnalyticsTelemetryRegistry();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private PaymentAnalyticsService service(FakeDataSource store) {
        return new PaymentAnalyticsService(
                AnalyticsProvider.sqlx(store, telemetry), new MetricsFanout(executor), telemetry);
    }

    private static GetPaymentMetricRequest request(Set<PaymentMetrics> metrics, Granularity granularity) {
        return new GetPaymentMetricRequest(DAY, List.of(), PaymentFilters.none(), metrics, granularity, null);
    }

    @Test
    void withoutGranularityTheOnlyBucketIsTheRequestedRange() {
        FakeDataSource store = FakeDataSource.returning("postgres", List.of(Map.of("count", 3)));

        MetricsResponse<PaymentMetricsBucketResponse> response =
                service(store).getMetrics(MERCHANT, request(Set.of(PaymentMetrics.PAYMENT_COUNT), null));

        assertThat(response.queryData()).hasSize(1);
        PaymentMetricsBucketResponse bucket = response.queryData().get(0);
        assertThat(bucket.values().paymentCount()).isEqualTo(3L);
        assertThat(bucket.values().paymentSuccessRate()).isNull();
        assertThat(bucket.dimensions().timeBucket()).isEqualTo(DAY);
        assertThat(bucket.dimensions().startTime()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(response.metaData()).containsExactly(new AnalyticsMetadata(DAY));
        assertThat(store.queries()).singleElement().asString().contains("merchant_id = 'm1'");
        assertThat(telemetry.snapshot().rowsLoaded()).containsValue(1L);
    }

    @Test
    void metricsOfTheSameHourMergeIntoOneBucket() {
        FakeDataSource store = new FakeDataSource("postgres", query -> query.contains("status")
                ? List.of(
                        Map.of("status", "charged", "count", 3,
                                "start_bucket", "2024-01-01 10:05:00", "end_bucket", "2024-01-01 10:55:00"),
                        Map.of("status", "failure", "count", 1,
                                "start_bucket", "2024-01-01 10:10:00", "end_bucket", "2024-01-01 10:40:00"))
                : List.of(Map.of("count", 4,
                        "start_bucket", "2024-01-01 10:01:00", "end_bucket", "2024-01-01 10:59:00")));

        MetricsResponse<PaymentMetricsBucketResponse> response = service(store).getMetrics(
                MERCHANT,
                request(Set.of(PaymentMetrics.PAYMENT_COUNT, PaymentMetrics.PAYMENT_SUCCESS_RATE),
                        Granularity.ONE_HOUR));

        assertThat(response.queryData()).hasSize(1);
        PaymentMetricsBucketResponse bucket = response.queryData().get(0);
        assertThat(bucket.values().paymentCount()).isEqualTo(4L);
        assertThat(bucket.values().paymentSuccessRate()).isCloseTo(75.0d, within(1e-9));
        assertThat(bucket.dimensions().status()).isNull();
        assertThat(bucket.dimensions().timeBucket())
                .isEqualTo(TimeRange.of(
                        Instant.parse("2024-01-01T10:00:00Z"), Instant.parse("2024-01-01T10:59:59Z")));
        assertThat(store.queries()).hasSize(2);
    }

    @Test
    void errorMessageDistributionSharesTheCountBucket() {
        FakeDataSource store = new FakeDataSource("postgres", query -> query.contains("error_message")
                ? List.of(
                        Map.of("error_message", "card declined", "count", 3),
                        Map.of("error_message", "timeout", "count", 1))
                : List.of(Map.of("count", 10)));
        GetPaymentMetricRequest request = new GetPaymentMetricRequest(
                DAY,
                List.of(),
                PaymentFilters.none(),
                Set.of(PaymentMetrics.PAYMENT_COUNT),
                null,
                new Distribution<>(PaymentDistributions.PAYMENT_ERROR_MESSAGE, DistributionCardinality.TOP_5));

        MetricsResponse<PaymentMetricsBucketResponse> response = service(store).getMetrics(MERCHANT, request);

        assertThat(response.queryData()).hasSize(1);
        PaymentMetricsBucketValue values = response.queryData().get(0).values();
        assertThat(values.paymentCount()).isEqualTo(10L);
        assertThat(values.paymentErrorMessage())
                .containsExactly(
                        new DistributionEntry("card declined", 3L, 75.0d),
                        new DistributionEntry("timeout", 1L, 25.0d));
    }

    @Test
    void missingMerchantAnswersEmptyWithoutQuerying() {
        FakeDataSource store = FakeDataSource.returning("postgres", List.of(Map.of("count", 3)));

        MetricsResponse<PaymentMetricsBucketResponse> response = service(store)
                .getMetrics(new AnalyticsScope(null, List.of(), "pk_1"),
                        request(Set.of(PaymentMetrics.PAYMENT_COUNT), null));

        assertThat(response.queryData()).isEmpty();
        assertThat(response.metaData()).containsExactly(new AnalyticsMetadata(DAY));
        assertThat(store.queries()).isEmpty();
    }

    @Test
    void requestWithoutMetricsIsRejected() {
        FakeDataSource store = FakeDataSource.returning("postgres", List.of());

        assertThrows(IllegalArgumentException.class,
                () -> service(store).getMetrics(MERCHANT, request(Set.of(), null)));
    }

    @Test
    void missingScopeWinsOverAnEmptyMetricSet() {
        FakeDataSource store = FakeDataSource.returning("postgres", List.of());

        MetricsResponse<PaymentMetricsBucketResponse> response =
                service(store).getMetrics(null, request(Set.of(), null));

        assertThat(response.queryData()).isEmpty();
        assertThat(response.metaData()).containsExactly(new AnalyticsMetadata(DAY));
        assertThat(store.queries()).isEmpty();
    }

    @Test
    void storeFailureFailsTheWholeRequest() {
        FakeDataSource store = FakeDataSource.failing("postgres");

        MetricsException thrown = assertThrows(MetricsException.class, () -> service(store)
                .getMetrics(MERCHANT, request(
                        Set.of(PaymentMetrics.PAYMENT_COUNT, PaymentMetrics.AVG_TICKET_SIZE), null)));

        assertThat(thrown.kind()).isEqualTo(MetricsErrorKind.QUERY_EXECUTION);
    }

    @Test
    void profilesAndFiltersNarrowTheQuery() {
        FakeDataSource store = FakeDataSource.returning("postgres", List.of());
        PaymentFilters filters = new PaymentFilters(
                List.of("USD"), List.of(), List.of("stripe"), List.of(), List.of(), List.of(), List.of(), List.of());
        GetPaymentMetricRequest request = new GetPaymentMetricRequest(
                DAY, List.of(PaymentDimensions.CONNECTOR), filters, Set.of(PaymentMetrics.PAYMENT_COUNT), null, null);

        MetricsResponse<PaymentMetricsBucketResponse> response = service(store)
                .getMetrics(new AnalyticsScope("m1", List.of("p1", "p2"), null), request);

        assertThat(response.queryData()).isEmpty();
        assertThat(store.queries()).singleElement().asString()
                .contains("profile_id IN ('p1', 'p2')")
                .contains("currency IN ('USD')")
                .contains("connector IN ('stripe')")
                .contains("GROUP BY connector");
    }
}
