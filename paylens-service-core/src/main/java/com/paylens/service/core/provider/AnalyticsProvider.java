package com.paylens.service.core.provider;

import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.error.MetricsException;
import com.paylens.service.core.metrics.MetricBucket;
import com.paylens.service.core.model.AnalyticsDomain;
import com.paylens.service.core.telemetry.AnalyticsTelemetry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes each metric load to the configured store(s). In the combined modes the same load also runs
 * against the other store, concurrently with the primary; its answer is only compared and logged, never
 * returned.
 */
@Slf4j
public class AnalyticsProvider {

    private final AnalyticsSource source;
    private final AnalyticsDataSource relational;
    private final ColumnarDataSource columnar;
    private final AnalyticsTelemetry telemetry;
    private final Executor shadowExecutor;

    private AnalyticsProvider(
            AnalyticsSource source,
            AnalyticsDataSource relational,
            ColumnarDataSource columnar,
            AnalyticsTelemetry telemetry,
            Executor shadowExecutor) {
        this.source = source;
        this.relational = relational;
        this.columnar = columnar;
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.shadowExecutor = shadowExecutor;
    }

    public static AnalyticsProvider sqlx(AnalyticsDataSource relational, AnalyticsTelemetry telemetry) {
        return new AnalyticsProvider(
                AnalyticsSource.SQLX, Objects.requireNonNull(relational, "relational"), null, telemetry, null);
    }

    public static AnalyticsProvider clickhouse(ColumnarDataSource columnar, AnalyticsTelemetry telemetry) {
        return new AnalyticsProvider(
                AnalyticsSource.CLICKHOUSE, null, Objects.requireNonNull(columnar, "columnar"), telemetry, null);
    }

    /**
     * @param shadowExecutor runs the shadow load while the calling thread runs the primary one. A shadow
     *     load that has not started by the time the primary finishes runs on the calling thread instead, so
     *     a saturated pool never leaves a caller waiting on a queued task.
     */
    public static AnalyticsProvider combined(
            AnalyticsSource source,
            AnalyticsDataSource relational,
            ColumnarDataSource columnar,
            AnalyticsTelemetry telemetry,
            Executor shadowExecutor) {
        if (source != AnalyticsSource.COMBINED_CKH && source != AnalyticsSource.COMBINED_SQLX) {
            throw new IllegalArgumentException("Not a combined analytics source: " + source);
        }
        return new AnalyticsProvider(
                source,
                Objects.requireNonNull(relational, "relational"),
                Objects.requireNonNull(columnar, "columnar"),
                telemetry,
                Objects.requireNonNull(shadowExecutor, "shadowExecutor"));
    }

    public AnalyticsSource source() {
        return source;
    }

    /** Loads a metric that both stores can serve. */
    public <T> List<T> load(AnalyticsDomain domain, String metric, Function<AnalyticsDataSource, List<T>> load) {
        return switch (source) {
            case SQLX -> timed(domain, metric, relational, load);
            case CLICKHOUSE -> timed(domain, metric, columnar, load);
            case COMBINED_CKH -> withShadow(domain, metric, columnar, relational, load);
            case COMBINED_SQLX -> withShadow(domain, metric, relational, columnar, load);
        };
    }

    /** Loads a metric whose collection only exists in the columnar store. */
    public <T> List<T> loadColumnar(
            AnalyticsDomain domain, String metric, Function<ColumnarDataSource, List<T>> load) {
        return switch (source) {
            case SQLX -> throw MetricsException.notImplemented(
                    domain.label() + " analytics on the relational store");
            case CLICKHOUSE, COMBINED_CKH, COMBINED_SQLX -> timed(domain, metric, columnar, load);
        };
    }

    private <S extends AnalyticsDataSource, T> List<T> timed(
            AnalyticsDomain domain, String metric, S dataSource, Function<S, List<T>> load) {
        long started = System.nanoTime();
        try {
            return load.apply(dataSource);
        } finally {
            telemetry.recordFetchTime(domain, metric, dataSource.name(), Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private <T> List<T> withShadow(
            AnalyticsDomain domain,
            String metric,
            AnalyticsDataSource primary,
            AnalyticsDataSource shadow,
            Function<AnalyticsDataSource, List<T>> load) {
        AtomicBoolean claimed = new AtomicBoolean();
        CompletableFuture<List<T>> shadowResult = new CompletableFuture<>();
        Runnable shadowLoad = () -> {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                shadowResult.complete(timed(domain, metric, shadow, load));
            } catch (RuntimeException | Error e) {
                shadowResult.completeExceptionally(e);
            }
        };
        try {
            shadowExecutor.execute(shadowLoad);
        } catch (RejectedExecutionException e) {
            log.debug("Shadow analytics load rejected by executor, running inline metric={}", metric);
        }

        List<T> primaryResult;
        try {
            primaryResult = timed(domain, metric, primary, load);
        } catch (RuntimeException | Error e) {
            // Skip a shadow load that has not started yet.
            claimed.set(true);
            throw e;
        }
        shadowLoad.run();

        List<T> shadowRows;
        try {
            shadowRows = shadowResult.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            log.warn(
                    "Shadow analytics load failed domain={} metric={} store={} kind={}",
                    domain.label(),
                    metric,
                    shadow.name(),
                    cause instanceof MetricsException ? ((MetricsException) cause).kind() : null,
                    cause);
            return primaryResult;
        }
        if (!sameRows(primaryResult, shadowRows)) {
            telemetry.recordShadowMismatch(domain, metric);
            log.error(
                    "Mismatch between {} and {} {} analytics metric={} {}={} {}={}",
                    primary.name(),
                    shadow.name(),
                    domain.label(),
                    metric,
                    primary.name(),
                    primaryResult,
                    shadow.name(),
                    shadowRows);
        }
        return primaryResult;
    }

    private static <T> boolean sameRows(List<T> left, List<T> right) {
        if (left.size() != right.size()) {
            return false;
        }
        return histogram(left).equals(histogram(right));
    }

    private static <T> Map<Object, Long> histogram(List<T> rows) {
        return rows.stream()
                .collect(Collectors.groupingBy(AnalyticsProvider::comparisonKey, Collectors.counting()));
    }

    private static Object comparisonKey(Object row) {
        if (row instanceof MetricBucket) {
            return ((MetricBucket<?, ?>) row).comparisonKey();
        }
        return row;
    }
}
