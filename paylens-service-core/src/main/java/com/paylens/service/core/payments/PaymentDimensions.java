package com.paylens.service.core.payments;

/** Columns payment metrics can be grouped by. */
public enum PaymentDimensions {
    CONNECTOR("connector"),
    PAYMENT_METHOD("payment_method"),
    PAYMENT_METHOD_TYPE("payment_method_type"),
    CURRENCY("currency"),
    AUTH_TYPE("authentication_type"),
    PAYMENT_STATUS("status"),
    CLIENT_SOURCE("client_source"),
    CLIENT_VERSION("client_version");

    private final String column;

    PaymentDimensions(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
