package com.paylens.service.core.apievents;

public enum ApiEventDimensions {
    STATUS_CODE("status_code"),
    FLOW_TYPE("flow_type"),
    API_FLOW("api_flow");

    private final String column;

    ApiEventDimensions(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
