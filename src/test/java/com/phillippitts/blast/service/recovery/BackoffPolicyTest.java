package com.phillippitts.blast.service.recovery;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy fixed = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, false);

    @Test
    void growsExponentiallyUntilCapped() {
        assertThat(fixed.delayFor(0, 0.9)).isEqualTo(Duration.ofMillis(100));
        assertThat(fixed.delayFor(1, 0.9)).isEqualTo(Duration.ofMillis(200));
        assertThat(fixed.delayFor(3, 0.9)).isEqualTo(Duration.ofMillis(800));
        assertThat(fixed.delayFor(4, 0.9)).isEqualTo(Duration.ofSeconds(1));
        assertThat(fixed.delayFor(30, 0.9)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void jitterScalesBetweenHalfAndOneAndAHalf() {
        BackoffPolicy jittered = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, true);

        assertThat(jittered.delayFor(0, 0.0)).isEqualTo(Duration.ofMillis(50));
        assertThat(jittered.delayFor(0, 0.5)).isEqualTo(Duration.ofMillis(100));
        assertThat(jittered.delayFor(4, 0.99)).isEqualTo(Duration.ofMillis(1490));
    }

    @Test
    void rejectsBaseBelowOne() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(2), 0.9, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
