package com.paylens.service.storage.jdbc;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.AnalyticsDataSource;
import com.paylens.service.core.backend.QueryDialect;
import com.paylens.service.core.backend.RowLoader;
import com.paylens.service.core.backend.TableEngine;
import com.paylens.service.core.query.QueryExecutionException;
import java.time.DateTimeException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/** Runs analytics queries against the PostgreSQL transaction tables. */
@Slf4j
public class JdbcAnalyticsClient implements AnalyticsDataSource {

    public static final String NAME = "postgres";

    private final JdbcTemplate jdbcTemplate;
    private final PostgresDialect dialect = new PostgresDialect();

    public JdbcAnalyticsClient(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
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
        return TableEngine.BASIC;
    }

    @Override
    public <T> List<T> loadResults(String query, RowLoader<T> loader) throws QueryExecutionException {
        try {
            return jdbcTemplate.query(query, (rs, rowNum) -> loader.fromRelational(rs));
        } catch (DataAccessException e) {
            log.warn("Relational analytics query failed: {}", e.getMessage());
            throw new QueryExecutionException("Relational analytics query failed", e);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new QueryExecutionException("Failed to decode relational analytics row", e);
        }
    }
}
