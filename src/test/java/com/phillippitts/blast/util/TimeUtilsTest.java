package com.phillippitts.blast.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimeUtilsTest {

    @Test
    void nanosToMillisKeepsFraction() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1.5);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void millisBetweenInstants() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        assertThat(TimeUtils.millisBetween(start, start.plusMillis(250))).isEqualTo(250.0);
        assertThat(TimeUtils.millisBetween(start.plusMillis(10), start)).isEqualTo(-10.0);
    }

    @Test
    void secondsToDurationSupportsFractions() {
        assertThat(TimeUtils.secondsToDuration(1.5)).isEqualTo(Duration.ofMillis(1500));
        assertThat(TimeUtils.secondsToDuration(0.001)).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void round3RoundsToThreeDecimals() {
        assertThat(TimeUtils.round3(1.23456)).isCloseTo(1.235, within(1e-9));
        assertThat(TimeUtils.round3(2.0)).isEqualTo(2.0);
    }
}
