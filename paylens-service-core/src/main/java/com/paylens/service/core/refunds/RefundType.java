package com.paylens.service.core.refunds;

import com.paylens.service.core.backend.DbEnum;

public enum RefundType implements DbEnum {
    INSTANT_REFUND("instant_refund"),
    REGULAR_REFUND("regular_refund"),
    RETRY_REFUND("retry_refund");

    private final String dbValue;

    RefundType(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }

    public static RefundType fromDbValue(String value) {
        for (RefundType type : values()) {
            if (type.dbValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown refund type: " + value);
    }
}
