package com.paylens.service.core.query;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.backend.QueryDialect;
import com.paylens.service.core.backend.RowLoader;
import com.paylens.service.core.backend.TableEngine;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates select, filter and group-by clauses for one analytics query and renders them through
 * the dialect of the data source it was created for.
 *
 * <p>Every clause is rendered as it is added, so a value or aggregate the backend cannot express fails
 * with {@link QueryBuildingException} before anything is sent. Predicates are AND-ed in insertion
 * order. An instance is executed at most once.
 */
@Slf4j
public final class QueryBuilder {

    public static final String TIME_BUCKET_ALIAS = "time_bucket";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final AnalyticsCollection collection;
    private final AnalyticsDataSource dataSource;
    private final QueryDialect dialect;
    private final TableEngine engine;
    private final String table;

    private final List<String> columns = new ArrayList<>();
    private final List<String> filters = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private boolean executed;

    private QueryBuilder(AnalyticsCollection collection, AnalyticsDataSource dataSource, String table) {
        this.collection = collection;
        this.dataSource = dataSource;
        this.dialect = dataSource.dialect();
        this.engine = dataSource.tableEngine(collection);
        this.table = table;
    }

    public static QueryBuilder forCollection(AnalyticsCollection collection, AnalyticsDataSource dataSource)
            throws QueryBuildingException {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(dataSource, "dataSource");
        return new QueryBuilder(collection, dataSource, dataSource.dialect().collection(collection));
    }

    public AnalyticsCollection collection() {
        return collection;
    }

    public QueryBuilder addSelectColumn(String column) throws QueryBuildingException {
        columns.add(identifier(column));
        return this;
    }

    public QueryBuilder addSelectColumn(Aggregate aggregate) throws QueryBuildingException {
        Objects.requireNonNull(aggregate, "aggregate");
        String expression = dialect.aggregate(aggregate, engine);
        columns.add(aggregate.alias() == null ? expression : expression + " as " + identifier(aggregate.alias()));
        return this;
    }

    public QueryBuilder addFilterClause(String column, QueryValue value) throws QueryBuildingException {
        return addCustomFilterClause(column, value, FilterType.EQUAL);
    }

    public QueryBuilder addNegativeFilterClause(String column, QueryValue value) throws QueryBuildingException {
        return addCustomFilterClause(column, value, FilterType.NOT_EQUAL);
    }

    /** Adds {@code column IN (...)}. The caller decides what an empty set means; here it is an error. */
    public QueryBuilder addFilterInRangeClause(String column, Collection<? extends QueryValue> values)
            throws QueryBuildingException {
        String lhs = identifier(column);
        if (values == null || values.isEmpty()) {
            throw new QueryBuildingException("IN filter on '" + column + "' requires at least one value");
        }
        String rendered = values.stream().map(v -> v.render(dialect)).collect(Collectors.joining(", "));
        filters.add(lhs + " IN (" + rendered + ")");
        return this;
    }

    public QueryBuilder addCustomFilterClause(String column, QueryValue value, FilterType type)
            throws QueryBuildingException {
        Objects.requireNonNull(type, "type");
        String lhs = identifier(column);
        switch (type) {
            case IN -> {
                return addFilterInRangeClause(column, value == null ? List.of() : List.of(value));
            }
            case IS_NOT_NULL -> filters.add(lhs + " " + type.operator());
            case EQUAL, NOT_EQUAL, GREATER_THAN, GREATER_THAN_EQUAL, LESS_THAN_EQUAL -> {
                if (value == null) {
                    throw new QueryBuildingException(type + " filter on '" + column + "' requires a value");
                }
                filters.add(lhs + " " + type.operator() + " " + value.render(dialect));
            }
        }
        return this;
    }

    public QueryBuilder addNotNullClause(String column) throws QueryBuildingException {
        return addCustomFilterClause(column, null, FilterType.IS_NOT_NULL);
    }

    /** {@code column >= start} plus {@code column <= end} when the range is closed. */
    public QueryBuilder addTimeRangeClause(TimeRange range, String column) throws QueryBuildingException {
        Objects.requireNonNull(range, "range");
        addCustomFilterClause(column, QueryValue.of(range.startTime()), FilterType.GREATER_THAN_EQUAL);
        if (range.endTime() != null) {
            addCustomFilterClause(column, QueryValue.of(range.endTime()), FilterType.LESS_THAN_EQUAL);
        }
        return this;
    }

    public QueryBuilder addGroupByClause(String column) throws QueryBuildingException {
        groupBy.add(identifier(column));
        return this;
    }

    /** Selects and groups by the start of each {@code granularity} bucket of {@code timeColumn}. */
    public QueryBuilder addGranularityClause(Granularity granularity, String timeColumn)
            throws QueryBuildingException {
        Objects.requireNonNull(granularity, "granularity");
        String bucket = dialect.timeBucket(granularity, identifier(timeColumn));
        columns.add(bucket + " as " + TIME_BUCKET_ALIAS);
        groupBy.add(bucket);
        return this;
    }

    public String buildQuery() throws QueryBuildingException {
        if (columns.isEmpty()) {
            throw new QueryBuildingException("No select fields provided for " + collection);
        }
        StringBuilder sql = new StringBuilder(256)
                .append("SELECT ")
                .append(String.join(", ", columns))
                .append(" FROM ")
                .append(table);
        if (!filters.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", filters));
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        return sql.toString();
    }

    /**
     * Renders and runs the query.
     *
     * @throws QueryBuildingException the query could not be rendered; nothing was sent to the backend
     * @throws QueryExecutionException the backend call or row decoding failed
     */
    public <T> List<T> execute(RowLoader<T> loader) throws QueryBuildingException, QueryExecutionException {
        if (executed) {
            throw new IllegalStateException("Query for " + collection + " was already executed");
        }
        executed = true;
        String query = buildQuery();
        if (log.isDebugEnabled()) {
            log.debug("Analytics query on {}:\n{}", dataSource.name(), query);
        }
        return dataSource.loadResults(query, loader);
    }

    private static String identifier(String column) throws QueryBuildingException {
        if (column == null || !IDENTIFIER.matcher(column).matches()) {
            throw new QueryBuildingException("Invalid column name: " + column);
        }
        return column;
    }
}
