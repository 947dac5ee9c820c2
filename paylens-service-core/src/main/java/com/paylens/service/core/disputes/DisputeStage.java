package com.paylens.service.core.disputes;

import com.paylens.service.core.backend.DbEnum;

public enum DisputeStage implements DbEnum {
    PRE_DISPUTE("pre_dispute"),
    DISPUTE("dispute"),
    PRE_ARBITRATION("pre_arbitration");

    private final String dbValue;

    DisputeStage(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }

    public static DisputeStage fromDbValue(String value) {
        for (DisputeStage stage : values()) {
            if (stage.dbValue.equals(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown dispute stage: " + value);
    }
}
