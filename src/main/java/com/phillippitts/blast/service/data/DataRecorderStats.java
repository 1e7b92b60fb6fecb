package com.phillippitts.blast.service.data;

/**
 * Reading counters of a {@link DataRecorder}.
 *
 * @param recorded readings accepted by the router
 * @param dropped readings the router refused
 */
public record DataRecorderStats(long recorded, long dropped) {
}
