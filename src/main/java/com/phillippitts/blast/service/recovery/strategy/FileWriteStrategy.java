package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.RecoveryContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Disk-full errors trigger the cleanup hook; any other write failure buffers the pending
 * data through the buffer hook until writes succeed again.
 */
public final class FileWriteStrategy extends AbstractRecoveryStrategy {

    private static final Logger LOG = LogManager.getLogger(FileWriteStrategy.class);

    public FileWriteStrategy(EventRecorder events) {
        super(ErrorCategory.FILE_WRITE, events);
    }

    @Override
    public boolean recover(Throwable error, RecoveryContext context) {
        String message = messageOf(error);
        if (isDiskFull(message)) {
            LOG.fatal("Disk full: {}", message);
            Optional<Runnable> cleanup = context.cleanup();
            cleanup.ifPresent(Runnable::run);
            return cleanup.isPresent();
        }
        Optional<Runnable> buffer = context.buffer();
        buffer.ifPresent(Runnable::run);
        return buffer.isPresent();
    }

    static boolean isDiskFull(String message) {
        return message.contains("No space left") || message.contains("ENOSPC");
    }
}
