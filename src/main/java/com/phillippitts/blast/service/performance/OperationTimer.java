package com.phillippitts.blast.service.performance;

/**
 * Scoped timer returned by {@link PerformanceMonitor#measure(String)}. Use with
 * try-with-resources; the sample is recorded on close whether or not the work failed.
 */
public final class OperationTimer implements AutoCloseable {

    private final PerformanceMonitor monitor;
    private final String operation;
    private final long startNanos;
    private boolean closed;

    OperationTimer(PerformanceMonitor monitor, String operation, long startNanos) {
        this.monitor = monitor;
        this.operation = operation;
        this.startNanos = startNanos;
    }

    public String operation() {
        return operation;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        monitor.complete(operation, System.nanoTime() - startNanos);
    }
}
