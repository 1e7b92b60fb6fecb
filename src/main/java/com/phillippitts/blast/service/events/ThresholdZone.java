package com.phillippitts.blast.service.events;

import com.phillippitts.blast.service.router.Severity;

/**
 * Sensor threshold zones, ordered by increasing severity.
 */
public enum ThresholdZone {
    NORMAL(EventKind.SENSOR_NORMAL, Severity.INFO),
    WARNING(EventKind.THRESHOLD_WARNING, Severity.WARNING),
    DANGER(EventKind.THRESHOLD_DANGER, Severity.ERROR),
    CRITICAL(EventKind.THRESHOLD_CRITICAL, Severity.CRITICAL);

    private final EventKind eventKind;
    private final Severity severity;

    ThresholdZone(EventKind eventKind, Severity severity) {
        this.eventKind = eventKind;
        this.severity = severity;
    }

    public EventKind eventKind() {
        return eventKind;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * Entries into this zone are recorded even when the sensor was already in it.
     */
    public boolean isAlwaysRecorded() {
        return this == DANGER || this == CRITICAL;
    }
}
