package com.paylens.service.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryExecutionException;
import org.junit.jupiter.api.Test;

class AnalyticsErrorsTest {

    @Test
    void internalFailuresAreReportedAsUnknown() {
        AnalyticsApiError building = AnalyticsErrors.toApiError(
                MetricsException.queryBuilding(new QueryBuildingException("bad column 'secret_table'")));
        AnalyticsApiError execution = AnalyticsErrors.toApiError(
                MetricsException.queryExecution(new QueryExecutionException("connection refused")));
        AnalyticsApiError postProcessing = AnalyticsErrors.toApiError(
                MetricsException.postProcessing("overflow", new ArithmeticException()));

        assertThat(building).isEqualTo(
                new AnalyticsApiError(AnalyticsApiError.Code.UNKNOWN_ERROR, AnalyticsErrors.UNKNOWN_MESSAGE));
        assertThat(execution).isEqualTo(building);
        assertThat(postProcessing).isEqualTo(building);
    }

    @Test
    void notImplementedNamesTheFeature() {
        AnalyticsApiError error =
                AnalyticsErrors.toApiError(MetricsException.notImplemented("sdk_events analytics on the relational store"));

        assertThat(error.code()).isEqualTo(AnalyticsApiError.Code.NOT_IMPLEMENTED);
        assertThat(error.message()).isEqualTo("Not Implemented: sdk_events analytics on the relational store");
    }

    @Test
    void onlyExecutionFailuresAreRetryable() {
        assertThat(MetricsErrorKind.QUERY_EXECUTION.retryable()).isTrue();
        assertThat(MetricsErrorKind.QUERY_BUILDING.retryable()).isFalse();
        assertThat(MetricsErrorKind.POST_PROCESSING.retryable()).isFalse();
        assertThat(MetricsErrorKind.NOT_IMPLEMENTED.retryable()).isFalse();
    }
}
