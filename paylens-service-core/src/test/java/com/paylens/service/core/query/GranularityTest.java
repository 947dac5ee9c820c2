package com.paylens.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class GranularityTest {

    @Test
    void clipsToEpochAlignedBuckets() {
        Instant t = Instant.parse("2024-05-10T13:47:12Z");

        assertThat(Granularity.FIFTEEN_MIN.clipToStart(t)).isEqualTo(Instant.parse("2024-05-10T13:45:00Z"));
        assertThat(Granularity.FIFTEEN_MIN.clipToEnd(t)).isEqualTo(Instant.parse("2024-05-10T13:59:59Z"));
        assertThat(Granularity.ONE_DAY.clipToStart(t)).isEqualTo(Instant.parse("2024-05-10T00:00:00Z"));
        assertThat(Granularity.ONE_DAY.clipToEnd(t)).isEqualTo(Instant.parse("2024-05-10T23:59:59Z"));
    }

    @Test
    void boundaryInstantStaysInItsOwnBucket() {
        Instant boundary = Instant.parse("2024-05-10T14:00:00Z");

        assertThat(Granularity.ONE_HOUR.clipToStart(boundary)).isEqualTo(boundary);
        assertThat(Granularity.ONE_HOUR.clipToEnd(boundary)).isEqualTo(Instant.parse("2024-05-10T14:59:59Z"));
    }

    @Test
    void clipsInstantsBeforeTheEpoch() {
        Instant t = Instant.parse("1969-12-31T23:59:30Z");

        assertThat(Granularity.ONE_MIN.clipToStart(t)).isEqualTo(Instant.parse("1969-12-31T23:59:00Z"));
    }

    @Test
    void parsesConfigValues() {
        assertThat(Granularity.fromConfigValue("5m")).isEqualTo(Granularity.FIVE_MIN);
        assertThat(Granularity.fromConfigValue("one_hour")).isEqualTo(Granularity.ONE_HOUR);
        assertThat(Granularity.fromConfigValue("P1D")).isEqualTo(Granularity.ONE_DAY);
        assertThrows(IllegalArgumentException.class, () -> Granularity.fromConfigValue("7m"));
    }
}
