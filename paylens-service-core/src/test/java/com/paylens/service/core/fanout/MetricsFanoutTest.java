package com.paylens.service.core.fanout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.paylens.service.core.error.MetricsErrorKind;
import com.paylens.service.core.error.MetricsException;
import com.paylens.service.core.query.QueryExecutionException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MetricsFanoutTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final MetricsFanout fanout = new MetricsFanout(executor);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void mergesEveryResultOnTheCallingThread() {
        Thread caller = Thread.currentThread();
        List<Thread> mergeThreads = new ArrayList<>();
        List<MetricTask<Map<String, Long>>> tasks = List.of(
                new MetricTask<>("a", () -> target -> {
                    mergeThreads.add(Thread.currentThread());
                    target.merge("bucket", 2L, Long::sum);
                }),
                new MetricTask<>("b", () -> target -> {
                    mergeThreads.add(Thread.currentThread());
                    target.merge("bucket", 3L, Long::sum);
                }));
        Map<String, Long> target = new HashMap<>();

        fanout.run(tasks, target);

        assertThat(target).containsEntry("bucket", 5L);
        assertThat(mergeThreads).containsOnly(caller);
    }

    @Test
    void failureIsThrownOnlyAfterEverySiblingFinished() {
        CountDownLatch failed = new CountDownLatch(1);
        AtomicBoolean slowFinished = new AtomicBoolean();
        MetricsException failure =
                MetricsException.queryExecution(new QueryExecutionException("store unavailable"));
        List<MetricTask<Map<String, Long>>> tasks = List.of(
                new MetricTask<>("failing", () -> {
                    failed.countDown();
                    throw failure;
                }),
                new MetricTask<>("slow", () -> {
                    awaitQuietly(failed);
                    sleepQuietly(100);
                    slowFinished.set(true);
                    return target -> target.put("slow", 1L);
                }));

        MetricsException thrown = assertThrows(MetricsException.class, () -> fanout.run(tasks, new HashMap<>()));

        assertThat(thrown).isSameAs(failure);
        assertThat(slowFinished).isTrue();
    }

    @Test
    void unexpectedTaskErrorsBecomeExecutionFailures() {
        List<MetricTask<Map<String, Long>>> tasks = List.of(new MetricTask<>("broken", () -> {
            throw new IllegalStateException("boom");
        }));

        MetricsException thrown = assertThrows(MetricsException.class, () -> fanout.run(tasks, new HashMap<>()));

        assertThat(thrown.kind()).isEqualTo(MetricsErrorKind.QUERY_EXECUTION);
        assertThat(thrown).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void mergeOverflowIsAPostProcessingFailure() {
        List<MetricTask<Map<String, Long>>> tasks = List.of(
                new MetricTask<>("huge", () -> target -> target.merge("bucket", Long.MAX_VALUE, Math::addExact)),
                new MetricTask<>("more", () -> target -> target.merge("bucket", Long.MAX_VALUE, Math::addExact)));

        MetricsException thrown = assertThrows(MetricsException.class, () -> fanout.run(tasks, new HashMap<>()));

        assertThat(thrown.kind()).isEqualTo(MetricsErrorKind.POST_PROCESSING);
    }

    @Test
    void unexpectedMergeErrorStillWaitsForSiblings() {
        AtomicBoolean slowFinished = new AtomicBoolean();
        List<MetricTask<Map<String, Long>>> tasks = List.of(
                new MetricTask<>("broken", () -> target -> {
                    throw new IllegalStateException("unexpected bucket");
                }),
                new MetricTask<>("slow", () -> {
                    sleepQuietly(100);
                    slowFinished.set(true);
                    return target -> target.put("slow", 1L);
                }));

        MetricsException thrown = assertThrows(MetricsException.class, () -> fanout.run(tasks, new HashMap<>()));

        assertThat(thrown.kind()).isEqualTo(MetricsErrorKind.POST_PROCESSING);
        assertThat(thrown).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(slowFinished).isTrue();
    }

    @Test
    void rejectedSubmissionCancelsTasksAlreadyRunning() {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        Executor oneSlot = command -> {
            if (accepted.getAndIncrement() > 0) {
                awaitQuietly(started);
                throw new RejectedExecutionException("pool exhausted");
            }
            executor.execute(command);
        };
        List<MetricTask<Map<String, Long>>> tasks = List.of(
                new MetricTask<>("running", () -> {
                    started.countDown();
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                    }
                    return target -> target.put("running", 1L);
                }),
                new MetricTask<>("rejected", () -> target -> target.put("rejected", 1L)));

        MetricsException thrown = assertThrows(
                MetricsException.class, () -> new MetricsFanout(oneSlot).run(tasks, new HashMap<>()));

        assertThat(thrown.kind()).isEqualTo(MetricsErrorKind.QUERY_EXECUTION);
        assertThat(thrown).hasCauseInstanceOf(RejectedExecutionException.class);
        awaitQuietly(interrupted);
        assertThat(interrupted.getCount()).isZero();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
