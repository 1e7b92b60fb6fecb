package com.phillippitts.blast.exception;

import com.phillippitts.blast.service.router.LogCategory;

/**
 * Thrown when the log router queue is full and a record cannot be accepted.
 *
 * <p>Callers should treat this as "system overloaded" and degrade (for example skip the
 * log line) instead of retrying in a tight loop.
 */
public class LogQueueOverloadedException extends LogRecordRejectedException {

    private final int capacity;

    public LogQueueOverloadedException(LogCategory category, int capacity) {
        super("Log queue is full (capacity " + capacity + ", category " + category
                + ") - system may be overloaded", category);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
