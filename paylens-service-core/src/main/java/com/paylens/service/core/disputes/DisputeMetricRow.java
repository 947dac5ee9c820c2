package com.paylens.service.core.disputes;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public record DisputeMetricRow(
        DisputeStage disputeStage,
        DisputeStatus disputeStatus,
        String connector,
        String currency,
        BigDecimal total,
        Long count,
        Instant startBucket,
        Instant endBucket) {

    public static final RowLoader<DisputeMetricRow> LOADER = new RowLoader<>() {
        @Override
        public DisputeMetricRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new DisputeMetricRow(
                    row.enumValue("dispute_stage", DisputeStage::fromDbValue),
                    row.enumValue("dispute_status", DisputeStatus::fromDbValue),
                    row.string("connector"),
                    row.string("currency"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public DisputeMetricRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new DisputeMetricRow(
                    row.enumValue("dispute_stage", DisputeStage::fromDbValue),
                    row.enumValue("dispute_status", DisputeStatus::fromDbValue),
                    row.string("connector"),
                    row.string("currency"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
