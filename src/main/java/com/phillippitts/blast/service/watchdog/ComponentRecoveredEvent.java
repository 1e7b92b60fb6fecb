package com.phillippitts.blast.service.watchdog;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when a heartbeat arrives for a frozen component.
 */
public record ComponentRecoveredEvent(String component, Instant recoveredAt, Duration frozenFor) {
}
