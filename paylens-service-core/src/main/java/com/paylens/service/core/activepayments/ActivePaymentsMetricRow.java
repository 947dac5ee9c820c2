package com.paylens.service.core.activepayments;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import java.sql.ResultSet;
import java.sql.SQLException;

public record ActivePaymentsMetricRow(Long count) {

    public static final RowLoader<ActivePaymentsMetricRow> LOADER = new RowLoader<>() {
        @Override
        public ActivePaymentsMetricRow fromRelational(ResultSet rs) throws SQLException {
            return new ActivePaymentsMetricRow(RelationalRow.of(rs).longValue("count"));
        }

        @Override
        public ActivePaymentsMetricRow fromColumnar(JsonNode node) {
            return new ActivePaymentsMetricRow(ColumnarRow.of(node).longValue("count"));
        }
    };
}
