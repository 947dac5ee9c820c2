package com.paylens.service.core.sdkevents;

import com.paylens.service.core.backend.DbEnum;

public enum SdkEventName implements DbEnum {
    PAYMENT_ATTEMPT("payment_attempt"),
    APP_RENDERED("app_rendered"),
    ELEMENTS_CALLED("elements_called"),
    PAYMENT_METHOD_CHANGED("payment_method_changed"),
    PAYMENT_DATA_FILLED("payment_data_filled");

    private final String dbValue;

    SdkEventName(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }
}
