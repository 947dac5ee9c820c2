package com.paylens.service.core.metrics;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** One result row of a metric query together with the bucket it merges into. */
public record MetricBucket<B, R>(B bucket, R row) {

    private static final Set<String> OBSERVED_WINDOW = Set.of("startBucket", "endBucket");

    /**
     * The bucket followed by the row's values, leaving out the observed window edges. Two stores that
     * agree on a bucket report the same key even when their first and last event times differ.
     */
    public List<Object> comparisonKey() {
        List<Object> key = new ArrayList<>();
        key.add(bucket);
        if (row == null || !row.getClass().isRecord()) {
            key.add(row);
            return key;
        }
        for (RecordComponent component : row.getClass().getRecordComponents()) {
            if (OBSERVED_WINDOW.contains(component.getName())) {
                continue;
            }
            key.add(normalize(valueOf(component)));
        }
        return key;
    }

    private Object valueOf(RecordComponent component) {
        try {
            return component.getAccessor().invoke(row);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + component.getName() + " of " + row.getClass(), e);
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
        }
        return value;
    }
}
