package com.paylens.service.core.payments;

import com.paylens.service.core.backend.DbEnum;

public enum IntentStatus implements DbEnum {
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    PROCESSING("processing"),
    REQUIRES_CUSTOMER_ACTION("requires_customer_action"),
    REQUIRES_PAYMENT_METHOD("requires_payment_method"),
    REQUIRES_CONFIRMATION("requires_confirmation"),
    REQUIRES_CAPTURE("requires_capture"),
    PARTIALLY_CAPTURED("partially_captured");

    private final String dbValue;

    IntentStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }
}
