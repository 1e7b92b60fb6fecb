package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;

/** No generic remedy exists; always reports failure so retries and escalation apply. */
public final class GenericStrategy extends AbstractRecoveryStrategy {

    public GenericStrategy(EventRecorder events) {
        super(ErrorCategory.GENERIC, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        return false;
    }
}
