package com.paylens.service.storage.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AnalyticsQueryExecutorTest {

    @Test
    void runsTasksOnNamedDaemonWorkers() throws Exception {
        AnalyticsQueryExecutor executor = new AnalyticsQueryExecutor(new AnalyticsProperties());
        executor.init(2, Duration.ofSeconds(1));
        try {
            Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

            assertThat(worker.getName()).startsWith("paylens-analytics-");
            assertThat(worker.isDaemon()).isTrue();
        } finally {
            executor.stop();
        }
    }

    @Test
    void rejectsWorkBeforeStartAndAfterStop() {
        AnalyticsQueryExecutor executor = new AnalyticsQueryExecutor(new AnalyticsProperties());

        assertThrows(IllegalStateException.class, () -> executor.execute(() -> {}));

        executor.init(1, Duration.ofMillis(100));
        executor.stop();

        assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> {}));
    }

    @Test
    void workerCountMustBePositive() {
        AnalyticsQueryExecutor executor = new AnalyticsQueryExecutor(new AnalyticsProperties());

        assertThrows(IllegalArgumentException.class, () -> executor.init(0, Duration.ofSeconds(1)));
    }

    @Test
    void startReadsTheConfiguredPool() throws Exception {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getQuery().setWorkers(1);
        AnalyticsQueryExecutor executor = new AnalyticsQueryExecutor(properties);
        executor.start();
        try {
            assertThat(CompletableFuture.supplyAsync(() -> "done", executor).get(5, TimeUnit.SECONDS))
                    .isEqualTo("done");
        } finally {
            executor.stop();
        }
    }
}
