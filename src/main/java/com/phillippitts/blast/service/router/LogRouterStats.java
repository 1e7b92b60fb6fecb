package com.phillippitts.blast.service.router;

import java.util.Map;

/**
 * Point-in-time router statistics.
 *
 * @param running whether the writer thread is alive
 * @param runId active run id, or null before the run is created
 * @param accepted records and artifacts accepted by {@code enqueue}
 * @param rejected records refused because the queue was full
 * @param written lines persisted per category
 * @param artifactsWritten artifacts persisted
 * @param writeFailures failed disk writes
 * @param queueDepth records currently waiting
 * @param queueCapacity configured queue bound
 */
public record LogRouterStats(boolean running,
                             String runId,
                             long accepted,
                             long rejected,
                             Map<LogCategory, Long> written,
                             long artifactsWritten,
                             long writeFailures,
                             int queueDepth,
                             int queueCapacity) {
}
