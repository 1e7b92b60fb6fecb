package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/** Runs the host's cleanup hook (cache eviction, buffer trimming) when memory runs out. */
public final class ResourceExhaustionStrategy extends AbstractRecoveryStrategy {

    private static final Logger LOG = LogManager.getLogger(ResourceExhaustionStrategy.class);

    public ResourceExhaustionStrategy(EventRecorder events) {
        super(ErrorCategory.RESOURCE_EXHAUSTION, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        Optional<Runnable> cleanup = context.cleanup();
        if (cleanup.isEmpty()) {
            LOG.warn("Resource exhaustion without cleanup hook: {}", messageOf(error));
            return false;
        }
        cleanup.get().run();
        return true;
    }
}
