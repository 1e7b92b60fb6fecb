package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.ConnectionState;
import com.phillippitts.blast.service.events.EventKind;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;
import com.phillippitts.blast.service.router.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reconnects a lost serial link. If reconnecting fails and a fallback is available the host
 * is switched to it (for example the simulator) and the loss counts as handled.
 */
public final class ConnectionLossStrategy extends AbstractRecoveryStrategy {

    private static final Logger LOG = LogManager.getLogger(ConnectionLossStrategy.class);

    public ConnectionLossStrategy(EventRecorder events) {
        super(ErrorCategory.CONNECTION_LOSS, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        String port = context.attributes().getOrDefault("port", "unknown");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("port", port);
        details.put("error", messageOf(error));
        recordEvent(ConnectionState.DISCONNECT.eventKind(), details, ConnectionState.DISCONNECT.severity());

        Optional<Runnable> reconnect = context.reconnect();
        if (reconnect.isEmpty()) {
            LOG.warn("No reconnect hook for {}; cannot recover connection", port);
            return false;
        }
        try {
            reconnect.get().run();
            recordEvent(ConnectionState.RECONNECT.eventKind(), Map.of("port", port), ConnectionState.RECONNECT.severity());
            LOG.info("Reconnected to {}", port);
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Reconnect to {} failed: {}", port, e.toString());
            Optional<Runnable> fallback = context.fallback();
            if (fallback.isEmpty()) {
                return false;
            }
            fallback.get().run();
            Map<String, Object> mode = new LinkedHashMap<>();
            mode.put("from_mode", context.attributes().getOrDefault("mode", "serial"));
            mode.put("to_mode", context.attributes().getOrDefault("fallback_mode", "simulator"));
            mode.put("reason", "Connection lost: " + messageOf(e));
            recordEvent(EventKind.MODE_CHANGE, mode, Severity.WARNING);
            LOG.warn("Switched to fallback source after losing {}", port);
            return true;
        }
    }
}
