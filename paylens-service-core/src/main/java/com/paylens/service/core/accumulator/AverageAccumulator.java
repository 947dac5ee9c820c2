package com.paylens.service.core.accumulator;

import java.math.BigDecimal;
import lombok.extern.slf4j.Slf4j;

/**
 * Average over rows that each carry a partial total and the number of items behind it. The result is
 * sum(totals) / sum(counts), so partial averages are never averaged with each other.
 */
@Slf4j
public final class AverageAccumulator implements MetricAccumulator<AverageAccumulator.Sample, Double> {

    private long total;
    private long count;

    @Override
    public void add(Sample sample) {
        // An ungrouped aggregate over no rows comes back as (NULL, 0).
        if (sample != null && sample.count() != null && sample.count() == 0L) {
            return;
        }
        Long sampleTotal = sample == null ? null : toLong(sample.total());
        Long sampleCount = sample == null || sample.count() == null || sample.count() < 0 ? null : sample.count();
        if (sampleTotal == null || sampleCount == null) {
            log.warn("Dropping row for average accumulator sample={}", sample);
            return;
        }
        total = Math.addExact(total, sampleTotal);
        count = Math.addExact(count, sampleCount);
    }

    public void merge(AverageAccumulator other) {
        total = Math.addExact(total, other.total);
        count = Math.addExact(count, other.count);
    }

    @Override
    public Double collect() {
        if (count == 0) {
            return null;
        }
        return (double) total / (double) count;
    }

    private static Long toLong(BigDecimal value) {
        if (value == null) {
            return null;
        }
        try {
            return value.toBigIntegerExact().longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    public record Sample(BigDecimal total, Long count) {}
}
