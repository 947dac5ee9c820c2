package com.paylens.service.core.disputes;

import com.paylens.service.core.backend.DbEnum;

public enum DisputeStatus implements DbEnum {
    DISPUTE_OPENED("dispute_opened"),
    DISPUTE_EXPIRED("dispute_expired"),
    DISPUTE_ACCEPTED("dispute_accepted"),
    DISPUTE_CANCELLED("dispute_cancelled"),
    DISPUTE_CHALLENGED("dispute_challenged"),
    DISPUTE_WON("dispute_won"),
    DISPUTE_LOST("dispute_lost");

    private final String dbValue;

    DisputeStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }

    public static DisputeStatus fromDbValue(String value) {
        for (DisputeStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown dispute status: " + value);
    }
}
