package com.paylens.service.core.payments;

import com.paylens.service.core.backend.DbEnum;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum AttemptStatus implements DbEnum {
    STARTED("started"),
    AUTHENTICATION_FAILED("authentication_failed"),
    ROUTER_DECLINED("router_declined"),
    AUTHENTICATION_PENDING("authentication_pending"),
    AUTHENTICATION_SUCCESSFUL("authentication_successful"),
    AUTHORIZED("authorized"),
    AUTHORIZATION_FAILED("authorization_failed"),
    CHARGED("charged"),
    AUTHORIZING("authorizing"),
    COD_INITIATED("cod_initiated"),
    VOIDED("voided"),
    VOID_INITIATED("void_initiated"),
    CAPTURE_INITIATED("capture_initiated"),
    CAPTURE_FAILED("capture_failed"),
    VOID_FAILED("void_failed"),
    AUTO_REFUNDED("auto_refunded"),
    PARTIAL_CHARGED("partial_charged"),
    UNRESOLVED("unresolved"),
    PENDING("pending"),
    FAILURE("failure"),
    PAYMENT_METHOD_AWAITED("payment_method_awaited"),
    CONFIRMATION_AWAITED("confirmation_awaited"),
    DEVICE_DATA_COLLECTION_PENDING("device_data_collection_pending");

    private static final Map<String, AttemptStatus> BY_DB_VALUE =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(AttemptStatus::dbValue, Function.identity()));

    private final String dbValue;

    AttemptStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @Override
    public String dbValue() {
        return dbValue;
    }

    public static AttemptStatus fromDbValue(String value) {
        AttemptStatus status = BY_DB_VALUE.get(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown attempt status: " + value);
        }
        return status;
    }
}
