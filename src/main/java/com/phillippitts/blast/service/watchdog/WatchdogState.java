package com.phillippitts.blast.service.watchdog;

/** Liveness state of a watched component. */
public enum WatchdogState {
    NORMAL,
    FROZEN
}
