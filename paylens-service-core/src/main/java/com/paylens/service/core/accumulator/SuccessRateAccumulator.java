package com.paylens.service.core.accumulator;

/** Percentage of successful items. Absent when no row was seen or the total is zero. */
public final class SuccessRateAccumulator implements MetricAccumulator<SuccessRateAccumulator.Outcome, Double> {

    private Long success;
    private Long total;

    @Override
    public void add(Outcome outcome) {
        if (outcome == null || outcome.count() == null) {
            return;
        }
        if (outcome.success()) {
            success = CountAccumulator.combine(success, outcome.count());
        }
        total = CountAccumulator.combine(total, outcome.count());
    }

    public void merge(SuccessRateAccumulator other) {
        success = CountAccumulator.combine(success, other.success);
        total = CountAccumulator.combine(total, other.total);
    }

    @Override
    public Double collect() {
        if (total == null || total == 0L) {
            return null;
        }
        long succeeded = success == null ? 0L : success;
        return succeeded * 100.0d / total;
    }

    public record Outcome(boolean success, Long count) {}
}
