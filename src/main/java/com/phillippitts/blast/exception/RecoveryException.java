package com.phillippitts.blast.exception;

import com.phillippitts.blast.service.recovery.ErrorCategory;

/**
 * Thrown when a retried operation is exhausted and the caller asks for its value anyway.
 */
public class RecoveryException extends BlastException {

    private final ErrorCategory category;
    private final int attempts;

    public RecoveryException(ErrorCategory category, int attempts, Throwable cause) {
        super("Operation failed after " + attempts + " attempt(s) (category: " + category + ")", cause);
        this.category = category;
        this.attempts = attempts;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public int getAttempts() {
        return attempts;
    }
}
