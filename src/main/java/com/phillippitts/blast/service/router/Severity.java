package com.phillippitts.blast.service.router;

import org.apache.logging.log4j.Level;

/**
 * Record severity. {@link #CRITICAL} is mirrored to the console at Log4j's FATAL level.
 */
public enum Severity {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARNING(Level.WARN),
    ERROR(Level.ERROR),
    CRITICAL(Level.FATAL);

    private final Level log4jLevel;

    Severity(Level log4jLevel) {
        this.log4jLevel = log4jLevel;
    }

    public Level toLog4jLevel() {
        return log4jLevel;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
