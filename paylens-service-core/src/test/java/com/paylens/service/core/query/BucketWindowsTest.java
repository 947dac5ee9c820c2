package com.paylens.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class BucketWindowsTest {

    private static final TimeRange REQUESTED =
            TimeRange.of(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"));

    @Test
    void withoutGranularityTheRequestedRangeIsTheBucket() {
        TimeRange window = BucketWindows.canonical(
                null, REQUESTED, Instant.parse("2024-01-01T03:00:00Z"), Instant.parse("2024-01-01T04:00:00Z"));

        assertThat(window).isEqualTo(REQUESTED);
    }

    @Test
    void differentObservationsInTheSameBucketProduceTheSameWindow() {
        TimeRange first = BucketWindows.canonical(
                Granularity.ONE_HOUR,
                REQUESTED,
                Instant.parse("2024-01-01T05:02:00Z"),
                Instant.parse("2024-01-01T05:10:00Z"));
        TimeRange second = BucketWindows.canonical(
                Granularity.ONE_HOUR,
                REQUESTED,
                Instant.parse("2024-01-01T05:30:00Z"),
                Instant.parse("2024-01-01T05:59:59Z"));

        assertThat(first).isEqualTo(second);
        assertThat(first.startTime()).isEqualTo(Instant.parse("2024-01-01T05:00:00Z"));
        assertThat(first.endTime()).isEqualTo(Instant.parse("2024-01-01T05:59:59Z"));
    }

    @Test
    void missingObservationsFallBackToTheRequestedBounds() {
        TimeRange window = BucketWindows.canonical(Granularity.ONE_HOUR, REQUESTED, null, null);

        assertThat(window).isEqualTo(REQUESTED);
    }

    @Test
    void openEndedRequestWithoutGranularityKeepsTheOpenEnd() {
        TimeRange open = TimeRange.since(Instant.parse("2024-01-01T00:00:00Z"));

        TimeRange window = BucketWindows.canonical(null, open, Instant.parse("2024-01-03T00:00:00Z"), null);

        assertThat(window.endTime()).isNull();
    }
}
