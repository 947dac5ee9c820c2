package com.paylens.service.core.error;

/**
 * Maps internal metric failures to the client-visible error. Only unsupported features are described
 * to the caller; everything else is reported as an unknown analytics error.
 */
public final class AnalyticsErrors {

    public static final String UNKNOWN_MESSAGE = "Unknown Analytics Error";

    private AnalyticsErrors() {}

    public static AnalyticsApiError toApiError(MetricsException ex) {
        return switch (ex.kind()) {
            case QUERY_BUILDING, QUERY_EXECUTION, POST_PROCESSING -> new AnalyticsApiError(
                    AnalyticsApiError.Code.UNKNOWN_ERROR, UNKNOWN_MESSAGE);
            case NOT_IMPLEMENTED -> new AnalyticsApiError(
                    AnalyticsApiError.Code.NOT_IMPLEMENTED, "Not Implemented: " + ex.feature());
        };
    }
}
