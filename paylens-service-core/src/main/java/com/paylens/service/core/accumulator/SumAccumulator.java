package com.paylens.service.core.accumulator;

import java.math.BigDecimal;

/** Sums amounts with the same absence rules as {@link CountAccumulator}. */
public final class SumAccumulator implements MetricAccumulator<BigDecimal, BigDecimal> {

    private BigDecimal sum;

    @Override
    public void add(BigDecimal contribution) {
        sum = combine(sum, contribution);
    }

    public void merge(SumAccumulator other) {
        sum = combine(sum, other.sum);
    }

    @Override
    public BigDecimal collect() {
        return sum;
    }

    private static BigDecimal combine(BigDecimal left, BigDecimal right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.add(right);
    }
}
