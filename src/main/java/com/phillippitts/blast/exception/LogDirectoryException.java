package com.phillippitts.blast.exception;

/**
 * Thrown when a run directory or one of its category files cannot be created.
 * This is a fatal error that prevents the telemetry subsystem from starting.
 */
public class LogDirectoryException extends BlastException {

    private final String path;

    public LogDirectoryException(String path, Throwable cause) {
        super("Cannot create log location: " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
