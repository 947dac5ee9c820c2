package com.paylens.service.storage.jdbc;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.DbEnum;
import com.paylens.service.core.backend.QueryDialect;
import com.paylens.service.core.backend.TableEngine;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuildingException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/** PostgreSQL rendering. Only the payment, refund and dispute tables live in the relational store. */
public class PostgresDialect implements QueryDialect {

    @Override
    public String collection(AnalyticsCollection collection) throws QueryBuildingException {
        return switch (collection) {
            case PAYMENT -> "payment_attempt";
            case PAYMENT_INTENT -> "payment_intent";
            case REFUND -> "refund";
            case DISPUTE -> "dispute";
            case SDK_EVENTS, API_EVENTS, ACTIVE_PAYMENTS -> throw new QueryBuildingException(
                    collection + " is not available in the relational store");
        };
    }

    @Override
    public String string(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String enumValue(DbEnum value) {
        return string(value.dbValue());
    }

    @Override
    public String number(Number value) {
        return value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString();
    }

    @Override
    public String timestamp(Instant value) {
        return "'" + DateTimeFormatter.ISO_INSTANT.format(value) + "'::timestamptz";
    }

    @Override
    public String aggregate(Aggregate aggregate, TableEngine engine) throws QueryBuildingException {
        if (aggregate instanceof Aggregate.Count count) {
            return count.field() == null ? "count(*)" : "count(" + count.field() + ")";
        }
        String field = requireField(aggregate);
        if (aggregate instanceof Aggregate.Sum) {
            return "sum(" + field + ")";
        }
        if (aggregate instanceof Aggregate.Min) {
            return "min(" + field + ")";
        }
        if (aggregate instanceof Aggregate.Max) {
            return "max(" + field + ")";
        }
        return "count(distinct " + field + ")";
    }

    @Override
    public String timeBucket(Granularity granularity, String column) {
        return "date_bin('" + granularity.minutes() + " minutes', " + column
                + ", TIMESTAMPTZ '1970-01-01 00:00:00+00')";
    }

    private static String requireField(Aggregate aggregate) throws QueryBuildingException {
        if (aggregate.field() == null) {
            throw new QueryBuildingException(aggregate.getClass().getSimpleName() + " aggregate requires a field");
        }
        return aggregate.field();
    }
}
