package com.phillippitts.blast.service.events;

import java.util.Locale;

/**
 * Closed taxonomy of domain events recorded during a run.
 */
public enum EventKind {
    // Serial link
    SERIAL_CONNECT,
    SERIAL_DISCONNECT,
    SERIAL_ERROR,
    SERIAL_RECONNECT,

    // Sensors
    THRESHOLD_WARNING,
    THRESHOLD_DANGER,
    THRESHOLD_CRITICAL,
    SENSOR_NORMAL,
    SENSOR_FAILURE,

    // Valves
    VALVE_OPEN,
    VALVE_CLOSE,
    VALVE_ERROR,
    VALVE_COMMAND,

    // System
    MODE_CHANGE,
    CONFIG_RELOAD,
    FREEZE_DETECTED,
    FREEZE_RECOVERED,
    ERROR_RECOVERY,
    ERROR_ESCALATION,
    STARTUP,
    SHUTDOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
