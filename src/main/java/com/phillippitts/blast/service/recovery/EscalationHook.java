package com.phillippitts.blast.service.recovery;

/**
 * Invoked when a category keeps failing after its retry budget, signalling that external
 * intervention (for example switching to a degraded mode) is needed.
 */
@FunctionalInterface
public interface EscalationHook {

    void escalate(ErrorCategory category, String message);
}
