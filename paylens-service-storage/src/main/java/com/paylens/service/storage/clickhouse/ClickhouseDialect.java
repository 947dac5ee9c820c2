package com.paylens.service.storage.clickhouse;

import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.DbEnum;
import com.paylens.service.core.backend.QueryDialect;
import com.paylens.service.core.backend.TableEngine;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuildingException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ClickHouse rendering. On collapsing tables every revision row carries a sign, so counts become
 * {@code sum(sign)} and sums are weighted by it.
 */
public class ClickhouseDialect implements QueryDialect {

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    @Override
    public String collection(AnalyticsCollection collection) {
        return switch (collection) {
            case PAYMENT -> "payment_attempts";
            case PAYMENT_INTENT -> "payment_intents";
            case REFUND -> "refunds";
            case DISPUTE -> "dispute";
            case SDK_EVENTS -> "sdk_events_audit";
            case API_EVENTS -> "api_events_audit";
            case ACTIVE_PAYMENTS -> "active_payments";
        };
    }

    @Override
    public String string(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
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
        return "toDateTime64('" + DATE_TIME.format(value) + "', 3, 'UTC')";
    }

    @Override
    public String aggregate(Aggregate aggregate, TableEngine engine) throws QueryBuildingException {
        String sign = engine instanceof TableEngine.CollapsingMergeTree collapsing ? collapsing.signColumn() : null;
        if (aggregate instanceof Aggregate.Count count) {
            if (sign == null) {
                return count.field() == null ? "count(*)" : "count(" + count.field() + ")";
            }
            return count.field() == null
                    ? "sum(" + sign + ")"
                    : "sumIf(" + sign + ", " + count.field() + " IS NOT NULL)";
        }
        String field = requireField(aggregate);
        if (aggregate instanceof Aggregate.Sum) {
            return sign == null ? "sum(" + field + ")" : "sum(" + sign + " * " + field + ")";
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
        return "toStartOfInterval(" + column + ", INTERVAL " + granularity.minutes() + " MINUTE)";
    }

    private static String requireField(Aggregate aggregate) throws QueryBuildingException {
        if (aggregate.field() == null) {
            throw new QueryBuildingException(aggregate.getClass().getSimpleName() + " aggregate requires a field");
        }
        return aggregate.field();
    }
}
