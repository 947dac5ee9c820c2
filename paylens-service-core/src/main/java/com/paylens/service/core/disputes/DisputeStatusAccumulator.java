package com.paylens.service.core.disputes;

import com.paylens.service.core.accumulator.CountAccumulator;
import com.paylens.service.core.accumulator.MetricAccumulator;

/** Challenged, won and lost dispute counts plus the total over every status. */
public final class DisputeStatusAccumulator
        implements MetricAccumulator<DisputeStatusAccumulator.StatusCount, DisputeStatusAccumulator.Counts> {

    private final CountAccumulator challenged = new CountAccumulator();
    private final CountAccumulator won = new CountAccumulator();
    private final CountAccumulator lost = new CountAccumulator();
    private final CountAccumulator total = new CountAccumulator();

    @Override
    public void add(StatusCount row) {
        if (row == null || row.status() == null || row.count() == null) {
            return;
        }
        switch (row.status()) {
            case DISPUTE_CHALLENGED -> challenged.add(row.count());
            case DISPUTE_WON -> won.add(row.count());
            case DISPUTE_LOST -> lost.add(row.count());
            default -> {}
        }
        total.add(row.count());
    }

    public void merge(DisputeStatusAccumulator other) {
        challenged.merge(other.challenged);
        won.merge(other.won);
        lost.merge(other.lost);
        total.merge(other.total);
    }

    @Override
    public Counts collect() {
        return new Counts(challenged.collect(), won.collect(), lost.collect(), total.collect());
    }

    public record StatusCount(DisputeStatus status, Long count) {}

    public record Counts(Long challenged, Long won, Long lost, Long total) {}
}
