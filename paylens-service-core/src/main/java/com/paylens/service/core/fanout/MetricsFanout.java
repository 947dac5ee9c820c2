package com.paylens.service.core.fanout;

import com.paylens.service.core.error.MetricsException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the metric tasks of one request concurrently and merges their results on the calling thread in
 * completion order. Every task is awaited; when any failed, the first failure taken from the completion
 * queue is thrown and all results are discarded.
 */
@Slf4j
public class MetricsFanout {

    private final Executor executor;

    public MetricsFanout(Executor executor) {
        this.executor = executor;
    }

    public <A> void run(List<MetricTask<A>> tasks, A target) {
        CompletionService<Completed<A>> completions = new ExecutorCompletionService<>(executor);
        List<Future<Completed<A>>> submitted = new ArrayList<>(tasks.size());
        for (MetricTask<A> task : tasks) {
            try {
                submitted.add(completions.submit(() -> new Completed<>(task.name(), task.work().get())));
            } catch (RejectedExecutionException e) {
                submitted.forEach(future -> future.cancel(true));
                log.warn("Metric task rejected metric={} cancelled={}", task.name(), submitted.size());
                throw MetricsException.queryExecution("Metric task rejected: " + task.name(), e);
            }
        }

        RuntimeException failure = null;
        for (int i = 0; i < tasks.size(); i++) {
            Future<Completed<A>> next;
            try {
                next = completions.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw MetricsException.queryExecution("Interrupted while waiting for metric queries", ie);
            }
            try {
                Completed<A> completed = next.get();
                if (failure == null) {
                    failure = merge(completed, target);
                } else {
                    log.debug("Discarding result of metric={} after an earlier failure", completed.name());
                }
            } catch (ExecutionException e) {
                RuntimeException cause = unwrap(e);
                if (failure == null) {
                    failure = cause;
                } else {
                    log.debug("Discarding additional metric failure", cause);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw MetricsException.queryExecution("Interrupted while waiting for metric queries", ie);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static <A> RuntimeException merge(Completed<A> completed, A target) {
        try {
            completed.merge().accept(target);
            return null;
        } catch (MetricsException e) {
            return e;
        } catch (RuntimeException e) {
            return MetricsException.postProcessing("Failed to merge rows of metric " + completed.name(), e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof MetricsException metricsException) {
            return metricsException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return MetricsException.queryExecution("Metric task failed: " + cause, cause);
    }

    private record Completed<A>(String name, Consumer<A> merge) {}
}
