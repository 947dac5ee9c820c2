package com.paylens.service.core.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ColumnarRowTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void readsQuotedNumbersAndUtcDateTimes() {
        ObjectNode node = MAPPER.createObjectNode()
                .put("count", "42")
                .put("total", "1050.5")
                .put("start_bucket", "2024-03-01 10:15:30")
                .put("end_bucket", "2024-03-01 10:15:30.250");

        ColumnarRow row = ColumnarRow.of(node);

        assertThat(row.longValue("count")).isEqualTo(42L);
        assertThat(row.decimal("total")).isEqualByComparingTo(new BigDecimal("1050.5"));
        assertThat(row.instant("start_bucket")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
        assertThat(row.instant("end_bucket")).isEqualTo(Instant.parse("2024-03-01T10:15:30.250Z"));
    }

    @Test
    void missingAndNullColumnsReadAsNull() {
        ObjectNode node = MAPPER.createObjectNode().putNull("currency");

        ColumnarRow row = ColumnarRow.of(node);

        assertThat(row.string("currency")).isNull();
        assertThat(row.longValue("count")).isNull();
        assertThat(row.instant("start_bucket")).isNull();
    }

    @Test
    void rejectsNonObjectRows() {
        assertThrows(IllegalArgumentException.class, () -> ColumnarRow.of(MAPPER.createArrayNode()));
    }
}
