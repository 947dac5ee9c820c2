package com.paylens.service.core.refunds;

public enum RefundDimensions {
    CURRENCY("currency"),
    REFUND_STATUS("refund_status"),
    CONNECTOR("connector"),
    REFUND_TYPE("refund_type");

    private final String column;

    RefundDimensions(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
