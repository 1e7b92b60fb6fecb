package com.phillippitts.blast.service.recovery;

import com.phillippitts.blast.exception.RecoveryException;

/**
 * Outcome of {@link ErrorRecoveryEngine#retryWithBackoff}.
 *
 * @param success whether some attempt succeeded
 * @param value the successful attempt's result (nullable)
 * @param error the last error when all attempts failed
 * @param attempts number of times the operation was invoked
 * @param category category the operation was retried under
 */
public record RetryResult<T>(boolean success, T value, Throwable error, int attempts, ErrorCategory category) {

    public static <T> RetryResult<T> succeeded(T value, int attempts, ErrorCategory category) {
        return new RetryResult<>(true, value, null, attempts, category);
    }

    public static <T> RetryResult<T> failed(Throwable error, int attempts, ErrorCategory category) {
        return new RetryResult<>(false, null, error, attempts, category);
    }

    public T orElse(T other) {
        return success ? value : other;
    }

    /**
     * @throws RecoveryException wrapping the last error if every attempt failed
     */
    public T getOrThrow() {
        if (!success) {
            throw new RecoveryException(category, attempts, error);
        }
        return value;
    }
}
