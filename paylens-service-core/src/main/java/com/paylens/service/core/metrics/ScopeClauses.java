package com.paylens.service.core.metrics;

import com.paylens.service.core.model.AnalyticsScope;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryValue;

/** Predicates restricting a query to the caller's data. */
public final class ScopeClauses {

    public static final String MERCHANT_ID = "merchant_id";
    public static final String PROFILE_ID = "profile_id";
    public static final String PUBLISHABLE_KEY = "publishable_key";

    private ScopeClauses() {}

    public static void merchant(QueryBuilder builder, AnalyticsScope scope) throws QueryBuildingException {
        builder.addFilterClause(MERCHANT_ID, QueryValue.of(scope.merchantId()));
        if (!scope.profileIds().isEmpty()) {
            builder.addFilterInRangeClause(PROFILE_ID, QueryValue.ofStrings(scope.profileIds()));
        }
    }

    public static void publishableKey(QueryBuilder builder, AnalyticsScope scope) throws QueryBuildingException {
        builder.addFilterClause(PUBLISHABLE_KEY, QueryValue.of(scope.publishableKey()));
    }
}
