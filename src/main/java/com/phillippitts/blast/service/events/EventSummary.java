package com.phillippitts.blast.service.events;

import java.util.Map;

/**
 * Counts of recorded events for the current session.
 */
public record EventSummary(long sessionId, long totalEvents, Map<EventKind, Long> countsByKind) {
}
