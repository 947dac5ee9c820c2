package com.paylens.service.core.model;

public enum AnalyticsDomain {
    PAYMENTS("payments"),
    REFUNDS("refunds"),
    DISPUTES("disputes"),
    SDK_EVENTS("sdk_events"),
    API_EVENTS("api_events"),
    ACTIVE_PAYMENTS("active_payments");

    private final String label;

    AnalyticsDomain(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
