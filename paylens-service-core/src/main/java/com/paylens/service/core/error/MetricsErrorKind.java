package com.paylens.service.core.error;

public enum MetricsErrorKind {
    /** A clause could not be rendered for the backend. */
    QUERY_BUILDING,
    /** Backend I/O or row decoding failed. */
    QUERY_EXECUTION,
    /** Rows came back but could not be turned into buckets. */
    POST_PROCESSING,
    /** The metric, domain or backend combination is intentionally unsupported. */
    NOT_IMPLEMENTED;

    /** Whether re-running the whole request could succeed. */
    public boolean retryable() {
        return switch (this) {
            case QUERY_EXECUTION -> true;
            case QUERY_BUILDING, POST_PROCESSING, NOT_IMPLEMENTED -> false;
        };
    }
}
