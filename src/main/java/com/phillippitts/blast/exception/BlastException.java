package com.phillippitts.blast.exception;

/**
 * Base exception for all telemetry subsystem errors.
 * Domain exceptions extend this class so callers can handle them uniformly.
 */
public class BlastException extends RuntimeException {

    public BlastException(String message) {
        super(message);
    }

    public BlastException(String message, Throwable cause) {
        super(message, cause);
    }

    public BlastException(Throwable cause) {
        super(cause);
    }
}
