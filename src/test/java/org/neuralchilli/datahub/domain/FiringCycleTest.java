package org.neuralchilli.datahub.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FiringCycleTest {

    @ParameterizedTest
    @CsvSource({
            "HOURLY,  2024-05-08T13:45:12Z, HOURLY@2024-05-08T13:00",
            "DAILY,   2024-05-08T13:45:12Z, DAILY@2024-05-08T00:00",
            "WEEKLY,  2024-05-08T13:45:12Z, WEEKLY@2024-05-06T00:00",
            "WEEKLY,  2024-05-06T00:00:00Z, WEEKLY@2024-05-06T00:00",
            "MONTHLY, 2024-05-08T13:45:12Z, MONTHLY@2024-05-01T00:00",
            "ONCE,    2024-05-08T13:45:12Z, ONCE"
    })
    void shouldFloorToPeriodBoundary(SchedulePeriod period, String now, String expectedId) {
        FiringCycle cycle = FiringCycle.current(period, Instant.parse(now), ZoneOffset.UTC);

        assertThat(cycle.id()).isEqualTo(expectedId);
        assertThat(cycle.period()).isEqualTo(period);
    }

    @Test
    void shouldUseZoneForBoundaries() {
        // 2024-05-05T23:30Z is Monday 01:30 in Paris
        FiringCycle cycle = FiringCycle.current(SchedulePeriod.WEEKLY,
                Instant.parse("2024-05-05T23:30:00Z"), ZoneId.of("Europe/Paris"));

        assertThat(cycle.id()).isEqualTo("WEEKLY@2024-05-06T00:00");
        assertThat(cycle.start()).isEqualTo(LocalDateTime.parse("2024-05-06T00:00"));
    }

    @Test
    void shouldShareOneCycleForAllOnceTasks() {
        FiringCycle first = FiringCycle.current(SchedulePeriod.ONCE, Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        FiringCycle second = FiringCycle.current(SchedulePeriod.ONCE, Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC);

        assertThat(first.id()).isEqualTo(second.id());
    }

    @Test
    void shouldParsePeriodNamesCaseInsensitively() {
        assertThat(SchedulePeriod.fromString("Hourly")).isEqualTo(SchedulePeriod.HOURLY);
        assertThat(SchedulePeriod.fromString(" monthly ")).isEqualTo(SchedulePeriod.MONTHLY);
        assertThatThrownBy(() -> SchedulePeriod.fromString("yearly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yearly");
    }
}
