package com.paylens.service.core.sdkevents;

import com.fasterxml.jackson.databind.JsonNode;
import com.paylens.service.core.backend.ColumnarRow;
import com.paylens.service.core.backend.RelationalRow;
import com.paylens.service.core.backend.RowLoader;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public record SdkEventMetricRow(
        String paymentMethod,
        String platform,
        String browserName,
        String source,
        String component,
        String paymentExperience,
        BigDecimal total,
        Long count,
        Instant startBucket,
        Instant endBucket) {

    public static final RowLoader<SdkEventMetricRow> LOADER = new RowLoader<>() {
        @Override
        public SdkEventMetricRow fromRelational(ResultSet rs) throws SQLException {
            RelationalRow row = RelationalRow.of(rs);
            return new SdkEventMetricRow(
                    row.string("payment_method"),
                    row.string("platform"),
                    row.string("browser_name"),
                    row.string("source"),
                    row.string("component"),
                    row.string("payment_experience"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }

        @Override
        public SdkEventMetricRow fromColumnar(JsonNode node) {
            ColumnarRow row = ColumnarRow.of(node);
            return new SdkEventMetricRow(
                    row.string("payment_method"),
                    row.string("platform"),
                    row.string("browser_name"),
                    row.string("source"),
                    row.string("component"),
                    row.string("payment_experience"),
                    row.decimal("total"),
                    row.longValue("count"),
                    row.instant("start_bucket"),
                    row.instant("end_bucket"));
        }
    };
}
