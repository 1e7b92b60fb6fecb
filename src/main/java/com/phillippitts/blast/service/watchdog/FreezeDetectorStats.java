package com.phillippitts.blast.service.watchdog;

import java.util.List;

/**
 * Aggregated freeze detector statistics.
 */
public record FreezeDetectorStats(boolean running,
                                  long totalHeartbeats,
                                  long freezesDetected,
                                  long recoveries,
                                  List<WatchdogStatus> watchdogs) {

    public long frozenCount() {
        return watchdogs.stream().filter(w -> w.state() == WatchdogState.FROZEN).count();
    }
}
