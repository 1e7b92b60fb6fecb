package com.phillippitts.blast.exception;

import com.phillippitts.blast.service.router.LogCategory;

/**
 * Thrown when the log router does not accept a record.
 *
 * <p>Best-effort producers (serial traffic, performance windows, recovery bookkeeping,
 * freeze alerts) catch this type and drop the record; losing a log line must never stop
 * the acquisition loop.
 *
 * @see LogQueueOverloadedException
 * @see LogRouterClosedException
 */
public abstract class LogRecordRejectedException extends BlastException {

    private final LogCategory category;

    protected LogRecordRejectedException(String message, LogCategory category) {
        super(message);
        this.category = category;
    }

    public LogCategory getCategory() {
        return category;
    }
}
