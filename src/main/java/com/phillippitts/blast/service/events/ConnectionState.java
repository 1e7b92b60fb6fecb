package com.phillippitts.blast.service.events;

import com.phillippitts.blast.service.router.Severity;

/**
 * Serial link transitions reported by the acquisition loop.
 */
public enum ConnectionState {
    CONNECT(EventKind.SERIAL_CONNECT, Severity.INFO),
    DISCONNECT(EventKind.SERIAL_DISCONNECT, Severity.WARNING),
    ERROR(EventKind.SERIAL_ERROR, Severity.ERROR),
    RECONNECT(EventKind.SERIAL_RECONNECT, Severity.INFO);

    private final EventKind eventKind;
    private final Severity severity;

    ConnectionState(EventKind eventKind, Severity severity) {
        this.eventKind = eventKind;
        this.severity = severity;
    }

    public EventKind eventKind() {
        return eventKind;
    }

    public Severity severity() {
        return severity;
    }
}
