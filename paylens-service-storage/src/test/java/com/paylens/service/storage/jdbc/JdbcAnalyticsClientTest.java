package com.paylens.service.storage.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.paylens.service.core.payments.AttemptStatus;
import com.paylens.service.core.payments.PaymentMetricRow;
import com.paylens.service.core.query.QueryExecutionException;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

class JdbcAnalyticsClientTest {

    private static final String QUERY = "SELECT status, count(*) as count FROM payment_attempt";

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final JdbcAnalyticsClient client = new JdbcAnalyticsClient(jdbcTemplate);

    @Test
    @SuppressWarnings("unchecked")
    void mapsRowsByColumnLabel() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(3);
        when(meta.getColumnLabel(1)).thenReturn("status");
        when(meta.getColumnLabel(2)).thenReturn("COUNT");
        when(meta.getColumnLabel(3)).thenReturn("start_bucket");
        when(rs.getString("status")).thenReturn("charged");
        when(rs.getLong("count")).thenReturn(7L);
        when(rs.wasNull()).thenReturn(false);
        when(rs.getTimestamp("start_bucket")).thenReturn(Timestamp.from(Instant.parse("2024-01-01T10:05:00Z")));
        when(jdbcTemplate.query(eq(QUERY), any(RowMapper.class))).thenAnswer(invocation -> {
            RowMapper<Object> mapper = invocation.getArgument(1);
            return List.of(mapper.mapRow(rs, 0));
        });

        List<PaymentMetricRow> rows = client.loadResults(QUERY, PaymentMetricRow.LOADER);

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.status()).isEqualTo(AttemptStatus.CHARGED);
            assertThat(row.count()).isEqualTo(7L);
            assertThat(row.startBucket()).isEqualTo(Instant.parse("2024-01-01T10:05:00Z"));
            assertThat(row.connector()).isNull();
            assertThat(row.total()).isNull();
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void databaseErrorsBecomeExecutionFailures() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class)))
                .thenThrow(new BadSqlGrammarException("analytics", QUERY, new SQLException("no such column")));

        QueryExecutionException thrown =
                assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));

        assertThat(thrown).hasCauseInstanceOf(BadSqlGrammarException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void unknownEnumValuesBecomeDecodeFailures() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(1);
        when(meta.getColumnLabel(1)).thenReturn("status");
        when(rs.getString("status")).thenReturn("exploded");
        when(jdbcTemplate.query(anyString(), any(RowMapper.class))).thenAnswer(invocation -> {
            RowMapper<Object> mapper = invocation.getArgument(1);
            return List.of(mapper.mapRow(rs, 0));
        });

        QueryExecutionException thrown =
                assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));

        assertThat(thrown).hasMessageContaining("decode");
    }
}
