package com.paylens.service.core.apievents;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public record ApiEventMetricRow(
        Integer statusCode,
        String flowType,
        String apiFlow,
        BigDecimal total,
        Long count,
        Instant startBucket,
        Instant endBucket) {

    public static final RowLoader<ApiEventMetricRow> LOADER = new RowLoader<>() {
        @Override
        public ApiEventMetricRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new ApiEventMetricRow(
                    row.intValue("status_code"),
                    row.string("flow_type"),
                    row.string("api_flow"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public ApiEventMetricRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new ApiEventMetricRow(
                    row.intValue("status_code"),
                    row.string("flow_type"),
                    row.string("api_flow"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
