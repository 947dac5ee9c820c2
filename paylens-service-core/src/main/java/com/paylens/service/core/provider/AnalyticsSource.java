package com.paylens.service.core.provider;

import java.util.Locale;

/** Which stores serve analytics, and which answer wins when both are queried. */
public enum AnalyticsSource {
    /** Relational store only. */
    SQLX,
    /** Columnar store only. */
    CLICKHOUSE,
    /** Both stores, columnar result returned, mismatches logged. */
    COMBINED_CKH,
    /** Both stores, relational result returned, mismatches logged. */
    COMBINED_SQLX;

    public static AnalyticsSource fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return SQLX;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "SQLX", "POSTGRES", "POSTGRESQL" -> SQLX;
            case "CLICKHOUSE", "CKH" -> CLICKHOUSE;
            case "COMBINED_CKH", "COMBINEDCKH" -> COMBINED_CKH;
            case "COMBINED_SQLX", "COMBINEDSQLX" -> COMBINED_SQLX;
            default -> throw new IllegalArgumentException("Unsupported analytics source: " + value);
        };
    }
}
