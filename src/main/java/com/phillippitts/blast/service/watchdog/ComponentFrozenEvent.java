package com.phillippitts.blast.service.watchdog;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Published once per freeze episode when a component misses its heartbeat timeout.
 *
 * @param component watched component
 * @param detectedAt when the poll loop noticed the freeze
 * @param lastHeartbeat last heartbeat seen before the freeze
 * @param frozenFor time since that heartbeat at detection
 * @param timeout configured timeout
 * @param freezeCount total freezes detected so far, across components
 */
public record ComponentFrozenEvent(String component,
                                   Instant detectedAt,
                                   Instant lastHeartbeat,
                                   Duration frozenFor,
                                   Duration timeout,
                                   long freezeCount) {

    public ComponentFrozenEvent {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(detectedAt, "detectedAt");
    }
}
