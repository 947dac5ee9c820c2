package com.paylens.service.core.refunds;

import java.time.Instant;

public interface RefundDimensionRow {
    String currency();

    RefundStatus refundStatus();

    String connector();

    RefundType refundType();

    Instant startBucket();

    Instant endBucket();
}
