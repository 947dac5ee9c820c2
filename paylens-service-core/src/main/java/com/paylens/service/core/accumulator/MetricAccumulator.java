package com.paylens.service.core.accumulator;

/**
 * Per-bucket running state of one metric. Created on first sight of a bucket, fed once per contributing
 * row (rows may come from different queries), collected once when the request completes.
 *
 * @param <I> contribution extracted from one row
 * @param <T> public result
 */
public interface MetricAccumulator<I, T> {

    void add(I contribution);

    /** Result, or {@code null} when nothing was observed. */
    T collect();
}
