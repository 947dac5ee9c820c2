package com.paylens.service.storage.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Bounded worker pool shared by every metric query of every request. */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalyticsQueryExecutor implements Executor {

    private final AnalyticsProperties properties;

    private ExecutorService executor;
    private Duration shutdownTimeout;

    @PostConstruct
    void start() {
        AnalyticsProperties.Query query = properties.getQuery();
        init(query.getWorkers(), query.getShutdownTimeout());
    }

    void init(int workers, Duration shutdownTimeout) {
        if (workers < 1) {
            throw new IllegalArgumentException("paylens.analytics.query.workers must be positive: " + workers);
        }
        this.shutdownTimeout = shutdownTimeout;
        executor = Executors.newFixedThreadPool(workers, new QueryThreadFactory());
        log.info("Analytics query executor started workers={}", workers);
    }

    @Override
    public void execute(Runnable command) {
        if (executor == null) {
            throw new IllegalStateException("Analytics query executor is not started");
        }
        executor.execute(command);
    }

    @PreDestroy
    void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Analytics queries still running after {}, cancelling", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static final class QueryThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "paylens-analytics-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
