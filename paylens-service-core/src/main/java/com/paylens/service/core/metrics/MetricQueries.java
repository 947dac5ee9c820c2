package com.paylens.service.core.metrics;

import com.paylens.service.core.backend.RowLoader;
import com.paylens.service.core.error.MetricsException;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryExecutionException;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Shared plumbing of the metric implementations: run a query plan and attach bucket identifiers. */
public final class MetricQueries {

    private MetricQueries() {}

    @FunctionalInterface
    public interface QueryPlan {
        QueryBuilder build() throws QueryBuildingException;
    }

    public static <T> List<T> execute(QueryPlan plan, RowLoader<T> loader) {
        try {
            return plan.build().execute(loader);
        } catch (QueryBuildingException e) {
            throw MetricsException.queryBuilding(e);
        } catch (QueryExecutionException e) {
            throw MetricsException.queryExecution(e);
        }
    }

    /** Derives every row's bucket. One row that cannot be bucketed fails the whole result set. */
    public static <B, R> List<MetricBucket<B, R>> toBuckets(List<R> rows, Function<R, B> identify) {
        List<MetricBucket<B, R>> out = new ArrayList<>(rows.size());
        for (R row : rows) {
            B bucket;
            try {
                bucket = identify.apply(row);
            } catch (DateTimeException | ArithmeticException | IllegalArgumentException e) {
                throw MetricsException.postProcessing("Failed to derive time bucket for row " + row, e);
            }
            out.add(new MetricBucket<>(bucket, row));
        }
        return out;
    }
}
