package com.paylens.service.core.error;

/** Client-visible analytics error. */
public record AnalyticsApiError(Code code, String message) {

    public enum Code {
        UNKNOWN_ERROR,
        NOT_IMPLEMENTED
    }
}
