package com.phillippitts.blast.service.router;

import com.phillippitts.blast.exception.LogQueueOverloadedException;
import com.phillippitts.blast.exception.LogRouterClosedException;

/**
 * Destination for persisted telemetry output. Implementations must return quickly and never
 * block on I/O.
 */
public interface RecordSink {

    /**
     * Queues a record for its category stream.
     *
     * @throws LogQueueOverloadedException if the sink cannot accept more records
     * @throws LogRouterClosedException if the sink has been shut down
     */
    void enqueue(LogRecord record);

    /**
     * Queues a whole-file artifact (for example a diagnostic dump) to be written into the
     * current run directory.
     *
     * @throws LogQueueOverloadedException if the sink cannot accept more records
     * @throws LogRouterClosedException if the sink has been shut down
     */
    void enqueueArtifact(String fileName, String content);
}
