package com.paylens.service.core.payments;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/** Superset of the columns any payment metric selects; unselected columns are {@code null}. */
public record PaymentMetricRow(
        String currency,
        AttemptStatus status,
        String connector,
        AuthenticationType authenticationType,
        String paymentMethod,
        String paymentMethodType,
        String clientSource,
        String clientVersion,
        BigDecimal total,
        Long count,
        Instant startBucket,
        Instant endBucket)
        implements PaymentDimensionRow {

    public static final RowLoader<PaymentMetricRow> LOADER = new RowLoader<>() {
        @Override
        public PaymentMetricRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new PaymentMetricRow(
                    row.string("currency"),
                    row.enumValue("status", AttemptStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("authentication_type", AuthenticationType::fromDbValue),
                    row.string("payment_method"),
                    row.string("payment_method_type"),
                    row.string("client_source"),
                    row.string("client_version"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public PaymentMetricRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new PaymentMetricRow(
                    row.string("currency"),
                    row.enumValue("status", AttemptStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("authentication_type", AuthenticationType::fromDbValue),
                    row.string("payment_method"),
                    row.string("payment_method_type"),
                    row.string("client_source"),
                    row.string("client_version"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
