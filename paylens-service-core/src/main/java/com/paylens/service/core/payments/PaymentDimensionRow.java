package com.paylens.service.core.payments;

import java.time.Instant;

/** Dimension and time columns shared by every payment result row. */
public interface PaymentDimensionRow {
    String currency();

    AttemptStatus status();

    String connector();

    AuthenticationType authenticationType();

    String paymentMethod();

    String paymentMethodType();

    String clientSource();

    String clientVersion();

    Instant startBucket();

    Instant endBucket();
}
