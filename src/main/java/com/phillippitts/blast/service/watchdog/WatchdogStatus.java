package com.phillippitts.blast.service.watchdog;

/**
 * Point-in-time view of one watchdog.
 */
public record WatchdogStatus(String component,
                             double timeoutSeconds,
                             double secondsSinceHeartbeat,
                             boolean active,
                             WatchdogState state,
                             long freezeEpisodes) {
}
