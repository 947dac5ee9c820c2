package com.paylens.service.core.backend;

/** Logical tables analytics queries can target. Physical names are resolved by each {@link QueryDialect}. */
public enum AnalyticsCollection {
    PAYMENT,
    PAYMENT_INTENT,
    REFUND,
    DISPUTE,
    SDK_EVENTS,
    API_EVENTS,
    ACTIVE_PAYMENTS
}
