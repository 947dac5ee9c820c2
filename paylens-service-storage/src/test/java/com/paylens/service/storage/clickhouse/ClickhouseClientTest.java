package com.paylens.service.storage.clickhouse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paylens.service.core.payments.PaymentMetricRow;
import com.paylens.service.core.query.QueryExecutionException;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ClickhouseClientTest {

    private static final String QUERY = "SELECT connector, sum(sign_flag) as count FROM payment_attempts";

    private final HttpClient http = mock(HttpClient.class);
    private final ClickhouseClient client = new ClickhouseClient(
            http, new ObjectMapper(), "http://clickhouse:8123", "reader", "secret", "analytics", Duration.ofSeconds(5));

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(http).send(any(HttpRequest.class), any());
    }

    @Test
    void postsTheQueryAndDecodesTheDataArray() throws Exception {
        respond(200, """
                {"meta":[{"name":"connector","type":"String"}],
                 "data":[{"connector":"stripe","count":"7","total":"12.50","start_bucket":"2024-01-01 10:05:00.000"},
                         {"connector":"adyen","count":2,"total":null}],
                 "rows":2}
                """);

        List<PaymentMetricRow> rows = client.loadResults(QUERY, PaymentMetricRow.LOADER);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).connector()).isEqualTo("stripe");
        assertThat(rows.get(0).count()).isEqualTo(7L);
        assertThat(rows.get(0).total()).isEqualByComparingTo(new BigDecimal("12.50"));
        assertThat(rows.get(0).startBucket()).isEqualTo(Instant.parse("2024-01-01T10:05:00Z"));
        assertThat(rows.get(1).count()).isEqualTo(2L);
        assertThat(rows.get(1).total()).isNull();

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(request.capture(), any());
        assertThat(request.getValue().uri()).isEqualTo(URI.create("http://clickhouse:8123/?database=analytics"));
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().timeout()).contains(Duration.ofSeconds(5));
        assertThat(request.getValue().headers().firstValue("Authorization"))
                .contains("Basic " + Base64.getEncoder().encodeToString("reader:secret".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void nonSuccessStatusCarriesTheServerMessage() throws Exception {
        respond(500, "Code: 60. DB::Exception: Table analytics.payment_attempts doesn't exist");

        QueryExecutionException thrown =
                assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));

        assertThat(thrown).hasMessageContaining("HTTP 500").hasMessageContaining("doesn't exist");
    }

    @Test
    void malformedBodiesAreRejected() throws Exception {
        respond(200, "not json at all");
        assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));
    }

    @Test
    void missingDataArrayIsRejected() throws Exception {
        respond(200, "{\"rows\":0}");

        QueryExecutionException thrown =
                assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));

        assertThat(thrown).hasMessageContaining("no data array");
    }

    @Test
    void undecodableRowsAreRejected() throws Exception {
        respond(200, "{\"data\":[{\"count\":\"seven\"}]}");

        QueryExecutionException thrown =
                assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));

        assertThat(thrown).hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void transportFailuresBecomeExecutionFailures() throws Exception {
        doThrow(new IOException("connection refused")).when(http).send(any(HttpRequest.class), any());

        QueryExecutionException thrown =
                assertThrows(QueryExecutionException.class, () -> client.loadResults(QUERY, PaymentMetricRow.LOADER));

        assertThat(thrown).hasMessageContaining("connection refused");
    }
}
