package com.paylens.service.core.query;

/**
 * Aggregate select expression. {@code field} may be {@code null} only for {@link Count}, where it
 * means "count every row in the group"; {@code alias} is optional everywhere.
 */
public sealed interface Aggregate
        permits Aggregate.Count, Aggregate.Sum, Aggregate.Min, Aggregate.Max, Aggregate.DistinctCount {

    String field();

    String alias();

    static Aggregate count(String alias) {
        return new Count(null, alias);
    }

    static Aggregate count(String field, String alias) {
        return new Count(field, alias);
    }

    static Aggregate sum(String field, String alias) {
        return new Sum(field, alias);
    }

    static Aggregate min(String field, String alias) {
        return new Min(field, alias);
    }

    static Aggregate max(String field, String alias) {
        return new Max(field, alias);
    }

    static Aggregate distinctCount(String field, String alias) {
        return new DistinctCount(field, alias);
    }

    record Count(String field, String alias) implements Aggregate {}

    record Sum(String field, String alias) implements Aggregate {}

    record Min(String field, String alias) implements Aggregate {}

    record Max(String field, String alias) implements Aggregate {}

    record DistinctCount(String field, String alias) implements Aggregate {}
}
