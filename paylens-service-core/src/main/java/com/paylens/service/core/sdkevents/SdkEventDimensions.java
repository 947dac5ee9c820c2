package com.paylens.service.core.sdkevents;

public enum SdkEventDimensions {
    PAYMENT_METHOD("payment_method"),
    PLATFORM("platform"),
    BROWSER_NAME("browser_name"),
    SOURCE("source"),
    COMPONENT("component"),
    PAYMENT_EXPERIENCE("payment_experience");

    private final String column;

    SdkEventDimensions(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
