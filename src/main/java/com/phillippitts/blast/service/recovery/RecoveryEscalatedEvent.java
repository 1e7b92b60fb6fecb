package com.phillippitts.blast.service.recovery;

import java.time.Instant;

/**
 * Published by the default escalation hook when a category needs external intervention.
 */
public record RecoveryEscalatedEvent(ErrorCategory category, String message, Instant at) {
}
