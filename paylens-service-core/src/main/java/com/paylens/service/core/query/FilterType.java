package com.paylens.service.core.query;

public enum FilterType {
    EQUAL("="),
    NOT_EQUAL("!="),
    IN("IN"),
    GREATER_THAN(">"),
    GREATER_THAN_EQUAL(">="),
    LESS_THAN_EQUAL("<="),
    IS_NOT_NULL("IS NOT NULL");

    private final String operator;

    FilterType(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
