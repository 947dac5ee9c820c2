package com.paylens.service.core.refunds.distribution;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import com.paylens.service.core.refunds.RefundDimensionRow;
import com.paylens.service.core.refunds.RefundStatus;
import com.paylens.service.core.refunds.RefundType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public record RefundDistributionRow(
        String currency,
        RefundStatus refundStatus,
        String connector,
        RefundType refundType,
        String refundReason,
        Long count,
        Instant startBucket,
        Instant endBucket)
        implements RefundDimensionRow {

    public static final RowLoader<RefundDistributionRow> LOADER = new RowLoader<>() {
        @Override
        public RefundDistributionRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new RefundDistributionRow(
                    row.string("currency"),
                    row.enumValue("refund_status", RefundStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("refund_type", RefundType::fromDbValue),
                    row.string("refund_reason"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public RefundDistributionRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new RefundDistributionRow(
                    row.string("currency"),
                    row.enumValue("refund_status", RefundStatus::fromDbValue),
                    row.string("connector"),
                    row.enumValue("refund_type", RefundType::fromDbValue),
                    row.string("refund_reason"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
