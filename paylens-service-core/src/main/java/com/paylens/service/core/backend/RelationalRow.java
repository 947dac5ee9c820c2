package com.paylens.service.core.backend;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Null-tolerant accessors over a JDBC row. A column the query did not select reads as {@code null},
 * so one row type can serve every combination of requested dimensions.
 */
public final class RelationalRow {

    private final ResultSet rs;
    private final Set<String> labels;

    private RelationalRow(ResultSet rs, Set<String> labels) {
        this.rs = rs;
        this.labels = labels;
    }

    public static RelationalRow of(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return new RelationalRow(rs, labels);
    }

    public boolean has(String column) {
        return labels.contains(column.toLowerCase(Locale.ROOT));
    }

    public String string(String column) throws SQLException {
        return has(column) ? rs.getString(column) : null;
    }

    public <E extends Enum<E>> E enumValue(String column, Function<String, E> parser) throws SQLException {
        String raw = string(column);
        return raw == null ? null : parser.apply(raw);
    }

    public Long longValue(String column) throws SQLException {
        if (!has(column)) {
            return null;
        }
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    public Integer intValue(String column) throws SQLException {
        if (!has(column)) {
            return null;
        }
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    public BigDecimal decimal(String column) throws SQLException {
        return has(column) ? rs.getBigDecimal(column) : null;
    }

    public Instant instant(String column) throws SQLException {
        if (!has(column)) {
            return null;
        }
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
