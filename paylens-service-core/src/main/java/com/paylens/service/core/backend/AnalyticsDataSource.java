package com.paylens.service.core.backend;

import com.paylens.service.core.query.QueryExecutionException;
import java.util.List;

/** A store analytics queries can run against. Implementations are shared across concurrent queries. */
public interface AnalyticsDataSource {

    /** Short name used in logs and telemetry. */
    String name();

    QueryDialect dialect();

    TableEngine tableEngine(AnalyticsCollection collection);

    <T> List<T> loadResults(String query, RowLoader<T> loader) throws QueryExecutionException;
}
