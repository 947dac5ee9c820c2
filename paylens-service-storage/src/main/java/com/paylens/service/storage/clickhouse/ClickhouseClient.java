package com.paylens.service.storage.clickhouse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.ColumnarDataSource;
import com.paylens.service.core.backend.QueryDialect;
import com.paylens.service.core.backend.RowLoader;
import com.paylens.service.core.backend.TableEngine;
import com.paylens.service.core.query.QueryExecutionException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Sends analytics queries to the ClickHouse HTTP interface and decodes its JSON output. */
@Slf4j
public class ClickhouseClient implements ColumnarDataSource {

    public static final String NAME = "clickhouse";
    static final String SIGN_COLUMN = "sign_flag";

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String authorization;
    private final Duration requestTimeout;
    private final ClickhouseDialect dialect = new ClickhouseDialect();

    public ClickhouseClient(
            HttpClient http,
            ObjectMapper mapper,
            String url,
            String username,
            String password,
            String database,
            Duration requestTimeout) {
        this.http = http;
        this.mapper = mapper;
        String base = url.endsWith("/") ? url : url + "/";
        this.endpoint = URI.create(base + "?database=" + URLEncoder.encode(database, StandardCharsets.UTF_8));
        this.authorization = "Basic "
                + Base64.getEncoder()
                        .encodeToString((username + ":" + (password == null ? "" : password))
                                .getBytes(StandardCharsets.UTF_8));
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public QueryDialect dialect() {
        return dialect;
    }

    @Override
    public TableEngine tableEngine(AnalyticsCollection collection) {
        return switch (collection) {
            case PAYMENT, PAYMENT_INTENT, REFUND, DISPUTE -> TableEngine.collapsing(SIGN_COLUMN);
            case SDK_EVENTS, API_EVENTS, ACTIVE_PAYMENTS -> TableEngine.BASIC;
        };
    }

    @Override
    public <T> List<T> loadResults(String query, RowLoader<T> loader) throws QueryExecutionException {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .header("Authorization", authorization)
                .header("Content-Type", "text/plain; charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(query + "\nFORMAT JSON", StandardCharsets.UTF_8));
        if (requestTimeout != null) {
            request.timeout(requestTimeout);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new QueryExecutionException("ClickHouse request failed: " + e.getMessage(), e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for ClickHouse", ie);
        }
        if (response.statusCode() / 100 != 2) {
            log.warn("ClickHouse responded with HTTP {}", response.statusCode());
            throw new QueryExecutionException(
                    "ClickHouse responded with HTTP " + response.statusCode() + ": " + response.body());
        }
        return decode(response.body(), loader);
    }

    private <T> List<T> decode(String body, RowLoader<T> loader) throws QueryExecutionException {
        JsonNode data;
        try {
            data = mapper.readTree(body).path("data");
        } catch (IOException e) {
            throw new QueryExecutionException("Malformed ClickHouse response", e);
        }
        if (!data.isArray()) {
            throw new QueryExecutionException("ClickHouse response has no data array");
        }
        List<T> rows = new ArrayList<>(data.size());
        try {
            for (JsonNode node : data) {
                rows.add(loader.fromColumnar(node));
            }
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new QueryExecutionException("Failed to decode ClickHouse analytics row", e);
        }
        return rows;
    }
}
