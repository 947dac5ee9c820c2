package com.paylens.service.core.accumulator;

/**
 * Sums counts while keeping "no data" apart from zero: absent + absent = absent, absent + x = x,
 * a + b = a + b.
 */
public final class CountAccumulator implements MetricAccumulator<Long, Long> {

    private Long count;

    @Override
    public void add(Long contribution) {
        count = combine(count, contribution);
    }

    public void merge(CountAccumulator other) {
        count = combine(count, other.count);
    }

    @Override
    public Long collect() {
        return count;
    }

    static Long combine(Long left, Long right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return Math.addExact(left, right);
    }
}
