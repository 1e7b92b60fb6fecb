package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;

/** Skips the malformed frame, resetting parser state first when the host provides a hook. */
public final class ParseFailureStrategy extends AbstractRecoveryStrategy {

    public ParseFailureStrategy(EventRecorder events) {
        super(ErrorCategory.PARSE_FAILURE, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        context.reset().ifPresent(Runnable::run);
        return true;
    }
}
