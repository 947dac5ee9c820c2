package com.paylens.service.core.payments.distribution;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import com.paylens.service.core.payments.AttemptStatus;
import com.paylens.service.core.payments.AuthenticationType;
import com.paylens.service.core.payments.PaymentDimensionRow;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public record PaymentDistributionRow(
        String currency,
        AttemptStatus status,
        String connector,
        AuthenticationType authenticationType,
        String paymentMethod,
        String paymentMethodType,
        String clientSource,
        String clientVersion,
        String errorMessage,
        Long count,
        Instant startBucket,
        Instant endBucket)
        implements PaymentDimensionRow {

    public static final RowLoader<PaymentDistributionRow> LOADER = new RowLoader<>() {
        @Override
        public PaymentDistributionRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new PaymentDistributionRow(
                    row.string("currency"),
                    row.enumValue("status", AttemptStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("authentication_type", AuthenticationType::fromDbValue),
                    row.string("payment_method"),
                    row.string("payment_method_type"),
                    row.string("client_source"),
                    row.string("client_version"),
                    row.string("error_message"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public PaymentDistributionRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new PaymentDistributionRow(
                    row.string("currency"),
                    row.enumValue("status", AttemptStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("authentication_type", AuthenticationType::fromDbValue),
                    row.string("payment_method"),
                    row.string("payment_method_type"),
                    row.string("client_source"),
                    row.string("client_version"),
                    row.string("error_message"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
