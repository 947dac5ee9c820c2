package com.paylens.service.core.backend;

import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuildingException;
import java.time.Instant;

/**
 * Renders domain values into query text for one backend. Every value type the query builder
 * understands has its own method here, so each backend has to provide every rendering.
 */
public interface QueryDialect {

    String collection(AnalyticsCollection collection) throws QueryBuildingException;

    String string(String value);

    String enumValue(DbEnum value);

    String number(Number value);

    String timestamp(Instant value);

    /** Renders the aggregate expression without its alias. */
    String aggregate(Aggregate aggregate, TableEngine engine) throws QueryBuildingException;

    /** Expression rounding {@code column} down to the start of its granularity bucket. */
    String timeBucket(Granularity granularity, String column);
}
