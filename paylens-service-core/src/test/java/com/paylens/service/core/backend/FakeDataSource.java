package com.paylens.service.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paylens.service.core.query.QueryExecutionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** In-memory store answering each query with JSON rows chosen from the query text. */
public class FakeDataSource implements ColumnarDataSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final Function<String, List<Map<String, Object>>> responder;
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final QueryDialect dialect = new TestDialect();

    public FakeDataSource(String name, Function<String, List<Map<String, Object>>> responder) {
        this.name = name;
        this.responder = responder;
    }

    public static FakeDataSource returning(String name, List<Map<String, Object>> rows) {
        return new FakeDataSource(name, query -> rows);
    }

    public static FakeDataSource failing(String name) {
        return new FakeDataSource(name, query -> {
            throw new IllegalStateException("unreachable");
        });
    }

    public List<String> queries() {
        return queries;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public QueryDialect dialect() {
        return dialect;
    }

    @Override
    public TableEngine tableEngine(AnalyticsCollection collection) {
        return TableEngine.BASIC;
    }

    @Override
    public <T> List<T> loadResults(String query, RowLoader<T> loader) throws QueryExecutionException {
        queries.add(query);
        List<Map<String, Object>> rows;
        try {
            rows = responder.apply(query);
        } catch (IllegalStateException e) {
            throw new QueryExecutionException(name + " is down", e);
        }
        List<T> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            JsonNode node = MAPPER.valueToTree(row);
            out.add(loader.fromColumnar(node));
        }
        return out;
    }
}
