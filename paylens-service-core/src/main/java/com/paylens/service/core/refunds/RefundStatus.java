package com.paylens.service.core.refunds;

import com.paylens.service.core.backend.DbEnum;

public enum RefundStatus implements DbEnum {
    SUCCESS("success"),
    FAILURE("failure"),
    PENDING("pending"),
    MANUAL_REVIEW("manual_review"),
    TRANSACTION_FAILURE("transaction_failure");

    private final String dbValue;

    RefundStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }

    public static RefundStatus fromDbValue(String value) {
        for (RefundStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown refund status: " + value);
    }
}
