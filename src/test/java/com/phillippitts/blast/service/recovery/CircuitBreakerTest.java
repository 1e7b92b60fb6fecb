package com.phillippitts.blast.service.recovery;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Duration COOLDOWN = Duration.ofSeconds(60);

    @Test
    void opensWhenThresholdReached() {
        CircuitBreaker breaker = new CircuitBreaker(ErrorCategory.TIMEOUT);

        assertThat(breaker.recordFailure(T0, 3, COOLDOWN)).isFalse();
        assertThat(breaker.recordFailure(T0, 3, COOLDOWN)).isFalse();
        assertThat(breaker.recordFailure(T0, 3, COOLDOWN)).isTrue();

        assertThat(breaker.isOpen(T0.plusSeconds(59))).isTrue();
        CircuitBreakerState state = breaker.snapshot(T0);
        assertThat(state.isOpen()).isTrue();
        assertThat(state.openUntilTime()).contains(T0.plus(COOLDOWN));
        assertThat(state.consecutiveFailures()).isEqualTo(3);
    }

    @Test
    void closesAfterCooldownButKeepsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker(ErrorCategory.TIMEOUT);
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure(T0, 3, COOLDOWN);
        }

        Instant later = T0.plus(COOLDOWN);
        assertThat(breaker.isOpen(later)).isFalse();
        assertThat(breaker.snapshot(later).consecutiveFailures()).isEqualTo(3);
        assertThat(breaker.recordFailure(later, 3, COOLDOWN)).isTrue();
    }

    @Test
    void successResetsEverything() {
        CircuitBreaker breaker = new CircuitBreaker(ErrorCategory.NETWORK);
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure(T0, 5, COOLDOWN);
        }

        breaker.recordSuccess();

        assertThat(breaker.isOpen(T0)).isFalse();
        assertThat(breaker.snapshot(T0).consecutiveFailures()).isZero();
        assertThat(breaker.snapshot(T0).openUntilTime()).isEmpty();
    }

    @Test
    void snapshotReportsClosedOnceCooldownPassed() {
        CircuitBreaker breaker = new CircuitBreaker(ErrorCategory.GENERIC);
        breaker.recordFailure(T0, 1, COOLDOWN);

        assertThat(breaker.snapshot(T0.plusSeconds(61)).isOpen()).isFalse();
    }
}
