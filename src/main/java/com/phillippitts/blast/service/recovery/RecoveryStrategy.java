package com.phillippitts.blast.service.recovery;

/**
 * Recovery behavior for one {@link ErrorCategory}.
 */
public interface RecoveryStrategy {

    ErrorCategory category();

    /**
     * Attempts to recover from the error.
     *
     * @return true if the caller may continue, false if recovery failed
     * @throws Exception treated by the engine as a failed recovery
     */
    boolean recover(Throwable error, RecoveryContext context) throws Exception;
}
