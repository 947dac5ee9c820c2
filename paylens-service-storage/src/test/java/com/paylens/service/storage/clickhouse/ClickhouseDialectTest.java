package com.paylens.service.storage.clickhouse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paylens.service.core.backend.AnalyticsCollection;
import com.paylens.service.core.backend.TableEngine;
import com.paylens.service.core.query.Aggregate;
import com.paylens.service.core.query.Granularity;
import com.paylens.service.core.query.QueryBuilder;
import com.paylens.service.core.query.QueryValue;
import com.paylens.service.core.query.TimeRange;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ClickhouseDialectTest {

    private final ClickhouseClient client = new ClickhouseClient(
            mock(HttpClient.class),
            new ObjectMapper(),
            "http://clickhouse:8123",
            "default",
            "",
            "analytics",
            Duration.ofSeconds(5));
    private final ClickhouseDialect dialect = new ClickhouseDialect();

    @Test
    void collapsingTablesWeightAggregatesBySign() throws Exception {
        String query = QueryBuilder.forCollection(AnalyticsCollection.PAYMENT, client)
                .addSelectColumn(Aggregate.count("count"))
                .addSelectColumn(Aggregate.sum("amount", "total"))
                .addFilterClause("merchant_id", QueryValue.of("m1"))
                .buildQuery();

        assertThat(query)
                .isEqualTo("SELECT sum(sign_flag) as count, sum(sign_flag * amount) as total FROM payment_attempts"
                        + " WHERE merchant_id = 'm1'");
    }

    @Test
    void countOfAFieldSkipsNullsOnCollapsingTables() throws Exception {
        assertThat(dialect.aggregate(Aggregate.count("status_code", "count"), TableEngine.collapsing("sign_flag")))
                .isEqualTo("sumIf(sign_flag, status_code IS NOT NULL)");
        assertThat(dialect.aggregate(Aggregate.count("status_code", "count"), TableEngine.BASIC))
                .isEqualTo("count(status_code)");
    }

    @Test
    void eventTablesUsePlainAggregatesAndIntervalBuckets() throws Exception {
        String query = QueryBuilder.forCollection(AnalyticsCollection.SDK_EVENTS, client)
                .addSelectColumn(Aggregate.count("count"))
                .addTimeRangeClause(TimeRange.since(Instant.parse("2024-05-01T12:00:00.250Z")), "created_at")
                .addGranularityClause(Granularity.FIVE_MIN, "created_at")
                .buildQuery();

        assertThat(query)
                .isEqualTo("SELECT count(*) as count, toStartOfInterval(created_at, INTERVAL 5 MINUTE) as time_bucket"
                        + " FROM sdk_events_audit"
                        + " WHERE created_at >= toDateTime64('2024-05-01 12:00:00.250', 3, 'UTC')"
                        + " GROUP BY toStartOfInterval(created_at, INTERVAL 5 MINUTE)");
    }

    @Test
    void escapesQuotesAndBackslashes() {
        assertThat(dialect.string("o'neil\\x")).isEqualTo("'o\\'neil\\\\x'");
    }

    @Test
    void mapsEveryCollection() {
        assertThat(dialect.collection(AnalyticsCollection.PAYMENT_INTENT)).isEqualTo("payment_intents");
        assertThat(dialect.collection(AnalyticsCollection.REFUND)).isEqualTo("refunds");
        assertThat(dialect.collection(AnalyticsCollection.API_EVENTS)).isEqualTo("api_events_audit");
        assertThat(dialect.collection(AnalyticsCollection.ACTIVE_PAYMENTS)).isEqualTo("active_payments");
        assertThat(client.tableEngine(AnalyticsCollection.DISPUTE)).isEqualTo(TableEngine.collapsing("sign_flag"));
        assertThat(client.tableEngine(AnalyticsCollection.API_EVENTS)).isEqualTo(TableEngine.BASIC);
    }
}
