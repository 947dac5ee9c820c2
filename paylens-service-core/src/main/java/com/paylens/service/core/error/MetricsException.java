package com.paylens.service.core.error;

import com.paylens.service.core.query.QueryBuildingException;
import com.paylens.service.core.query.QueryExecutionException;
import java.util.Objects;

/** Failure of one metric load, tagged with the kind that decides how it is reported. */
public class MetricsException extends RuntimeException {

    private final MetricsErrorKind kind;
    private final String feature;

    private MetricsException(MetricsErrorKind kind, String message, String feature, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.feature = feature;
    }

    public static MetricsException queryBuilding(QueryBuildingException cause) {
        return new MetricsException(
                MetricsErrorKind.QUERY_BUILDING, "Failed to build analytics query: " + cause.getMessage(), null, cause);
    }

    public static MetricsException queryExecution(QueryExecutionException cause) {
        return new MetricsException(
                MetricsErrorKind.QUERY_EXECUTION,
                "Failed to execute analytics query: " + cause.getMessage(),
                null,
                cause);
    }

    public static MetricsException queryExecution(String message, Throwable cause) {
        return new MetricsException(MetricsErrorKind.QUERY_EXECUTION, message, null, cause);
    }

    public static MetricsException postProcessing(String message, Throwable cause) {
        return new MetricsException(MetricsErrorKind.POST_PROCESSING, message, null, cause);
    }

    public static MetricsException notImplemented(String feature) {
        return new MetricsException(MetricsErrorKind.NOT_IMPLEMENTED, "Not implemented: " + feature, feature, null);
    }

    public MetricsErrorKind kind() {
        return kind;
    }

    /** The unsupported feature for {@link MetricsErrorKind#NOT_IMPLEMENTED}, otherwise {@code null}. */
    public String feature() {
        return feature;
    }
}
