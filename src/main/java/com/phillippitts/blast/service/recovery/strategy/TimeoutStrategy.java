package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.ConnectionState;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;

import java.util.LinkedHashMap;
import java.util.Map;

/** Records the timeout and lets the next read retry. */
public final class TimeoutStrategy extends AbstractRecoveryStrategy {

    public TimeoutStrategy(EventRecorder events) {
        super(ErrorCategory.TIMEOUT, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_type", "timeout");
        details.put("port", context.attributes().getOrDefault("port", "unknown"));
        details.put("error", messageOf(error));
        recordEvent(ConnectionState.ERROR.eventKind(), details, ConnectionState.ERROR.severity());
        return true;
    }
}
