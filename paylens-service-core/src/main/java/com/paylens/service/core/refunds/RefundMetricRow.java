package com.paylens.service.core.refunds;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public record RefundMetricRow(
        String currency,
        RefundStatus refundStatus,
        String connector,
        RefundType refundType,
        BigDecimal total,
        Long count,
        Instant startBucket,
        Instant endBucket)
        implements RefundDimensionRow {

    public static final RowLoader<RefundMetricRow> LOADER = new RowLoader<>() {
        @Override
        public RefundMetricRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new RefundMetricRow(
                    row.string("currency"),
                    row.enumValue("refund_status", RefundStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("refund_type", RefundType::fromDbValue),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public RefundMetricRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new RefundMetricRow(
                    row.string("currency"),
                    row.enumValue("refund_status", RefundStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("refund_type", RefundType::fromDbValue),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
