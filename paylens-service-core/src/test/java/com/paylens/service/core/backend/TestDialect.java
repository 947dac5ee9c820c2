package com.paylens.service.core.backend;

import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuildingException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Backend-neutral rendering for tests. */
public class TestDialect implements QueryDialect {

    @Override
    public String collection(AnalyticsCollection collection) {
        return collection.name().toLowerCase(Locale.ROOT);
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
        return value.toString();
    }

    @Override
    public String timestamp(Instant value) {
        return "'" + DateTimeFormatter.ISO_INSTANT.format(value) + "'";
    }

    @Override
    public String aggregate(Aggregate aggregate, TableEngine engine) throws QueryBuildingException {
        if (aggregate instanceof Aggregate.Count count) {
            return count.field() == null ? "count(*)" : "count(" + count.field() + ")";
        }
        if (aggregate.field() == null) {
            throw new QueryBuildingException("field required");
        }
        if (aggregate instanceof Aggregate.Sum) {
            return "sum(" + aggregate.field() + ")";
        }
        if (aggregate instanceof Aggregate.Min) {
            return "min(" + aggregate.field() + ")";
        }
        if (aggregate instanceof Aggregate.Max) {
            return "max(" + aggregate.field() + ")";
        }
        return "count(distinct " + aggregate.field() + ")";
    }

    @Override
    public String timeBucket(Granularity granularity, String column) {
        return "bucket(" + column + ", " + granularity.minutes() + ")";
    }
}
