package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;

/** Network errors are treated as transient; the caller simply carries on. */
public final class NetworkStrategy extends AbstractRecoveryStrategy {

    public NetworkStrategy(EventRecorder events) {
        super(ErrorCategory.NETWORK, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        return true;
    }
}
