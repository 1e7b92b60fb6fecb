package com.phillippitts.blast.exception;

import com.phillippitts.blast.service.router.LogCategory;

/**
 * Thrown when a record is offered after the log router has been shut down.
 */
public class LogRouterClosedException extends LogRecordRejectedException {

    public LogRouterClosedException(LogCategory category) {
        super("Log router is shut down; " + category + " record rejected", category);
    }
}
