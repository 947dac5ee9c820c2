package com.paylens.service.core.fanout;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One unit of a metrics request. {@code work} runs on a worker thread and returns the step that merges
 * its rows into the request's target; that step runs on the requesting thread.
 */
public record MetricTask<A>(String name, Supplier<Consumer<A>> work) {

    public MetricTask {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(work, "work");
    }
}
