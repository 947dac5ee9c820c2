package com.paylens.service.core.disputes;

public enum DisputeDimensions {
    DISPUTE_STAGE("dispute_stage"),
    CONNECTOR("connector"),
    CURRENCY("currency");

    private final String column;

    DisputeDimensions(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
