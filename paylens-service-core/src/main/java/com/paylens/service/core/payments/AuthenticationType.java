package com.paylens.service.core.payments;

import com.paylens.service.core.backend.DbEnum;

public enum AuthenticationType implements DbEnum {
    THREE_DS("three_ds"),
    NO_THREE_DS("no_three_ds");

    private final String dbValue;

    AuthenticationType(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }

    public static AuthenticationType fromDbValue(String value) {
        for (AuthenticationType type : values()) {
            if (type.dbValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown authentication type: " + value);
    }
}
