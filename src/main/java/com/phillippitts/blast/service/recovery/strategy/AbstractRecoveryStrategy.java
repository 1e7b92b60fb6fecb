package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.events.EventKind;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryStrategy;
import com.phillippitts.blast.service.router.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Shared plumbing for strategies: category binding and event recording that degrades
 * instead of failing the recovery when the router rejects the record.
 */
public abstract class AbstractRecoveryStrategy implements RecoveryStrategy {

    private static final Logger LOG = LogManager.getLogger(AbstractRecoveryStrategy.class);

    private final ErrorCategory category;
    protected final EventRecorder events;

    protected AbstractRecoveryStrategy(ErrorCategory category, EventRecorder events) {
        this.category = Objects.requireNonNull(category, "category");
        this.events = events;
    }

    @Override
    public final ErrorCategory category() {
        return category;
    }

    protected void recordEvent(EventKind kind, Map<String, ?> details, Severity severity) {
        if (events == null) {
            return;
        }
        try {
            events.record(kind, details, severity);
        } catch (LogRecordRejectedException e) {
            LOG.debug("Skipped {} event during {} recovery: {}", kind, category, e.getMessage());
        }
    }

    protected static String messageOf(Throwable error) {
        if (error == null) {
            return "";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
