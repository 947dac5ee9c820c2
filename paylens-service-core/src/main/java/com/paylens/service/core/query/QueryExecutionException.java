package com.paylens.service.core.query;

/** The backend failed to run a rendered query or its rows could not be decoded. May be transient. */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
