package com.paylens.service.core.model;

import java.util.Objects;

/** Breakdown request: which column to spread each bucket over and how many entries to keep. */
public record Distribution<D>(D distributionFor, DistributionCardinality cardinality) {

    public Distribution {
        Objects.requireNonNull(distributionFor, "distributionFor");
        cardinality = cardinality == null ? DistributionCardinality.TOP_5 : cardinality;
    }
}
