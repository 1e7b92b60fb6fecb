package com.phillippitts.blast.service.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the recent-operation history kept for freeze diagnostics.
 */
public record OperationRecord(Instant timestamp, String operation, Map<String, Object> details, String thread) {
}
