package com.paylens.service.core.backend;

/**
 * Storage-engine hint for a collection. Versioned stores keep every row revision together with a
 * sign column (+1 insert, -1 cancel), so counts and sums must be weighted by that column.
 */
public sealed interface TableEngine permits TableEngine.Basic, TableEngine.CollapsingMergeTree {

    TableEngine BASIC = new Basic();

    static TableEngine collapsing(String signColumn) {
        return new CollapsingMergeTree(signColumn);
    }

    record Basic() implements TableEngine {}

    record CollapsingMergeTree(String signColumn) implements TableEngine {
        public CollapsingMergeTree {
            if (signColumn == null || signColumn.isBlank()) {
                throw new IllegalArgumentException("signColumn is required");
            }
        }
    }
}
