package com.paylens.service.core.query;

/** A clause could not be rendered for the target backend. Deterministic: retrying cannot help. */
public class QueryBuildingException extends Exception {

    public QueryBuildingException(String message) {
        super(message);
    }

    public QueryBuildingException(String message, Throwable cause) {
        super(message, cause);
    }
}
