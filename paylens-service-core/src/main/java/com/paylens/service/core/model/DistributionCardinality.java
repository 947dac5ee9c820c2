package com.paylens.service.core.model;

public enum DistributionCardinality {
    TOP_5(5),
    TOP_10(10);

    private final int limit;

    DistributionCardinality(int limit) {
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
