package com.phillippitts.blast.exception;

import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.router.LogCategory;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void blastExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("disk");
        BlastException ex = new BlastException("wrapper", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void overloadExceptionShouldCarryCategoryAndCapacity() {
        LogQueueOverloadedException ex = new LogQueueOverloadedException(LogCategory.SERIAL, 10_000);

        assertThat(ex).isInstanceOf(LogRecordRejectedException.class).isInstanceOf(BlastException.class);
        assertThat(ex.getCategory()).isEqualTo(LogCategory.SERIAL);
        assertThat(ex.getCapacity()).isEqualTo(10_000);
        assertThat(ex.getMessage()).contains("10000").contains("overloaded");
    }

    @Test
    void closedRouterExceptionShouldBeARejection() {
        LogRouterClosedException ex = new LogRouterClosedException(LogCategory.EVENTS);

        assertThat(ex).isInstanceOf(LogRecordRejectedException.class);
        assertThat(ex.getCategory()).isEqualTo(LogCategory.EVENTS);
        assertThat(ex.getMessage()).contains("shut down");
    }

    @Test
    void directoryExceptionShouldIncludePath() {
        IOException cause = new IOException("read-only");
        LogDirectoryException ex = new LogDirectoryException("/var/blast/logs", cause);

        assertThat(ex.getMessage()).contains("/var/blast/logs");
        assertThat(ex.getPath()).isEqualTo("/var/blast/logs");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void recoveryExceptionShouldIncludeAttempts() {
        RuntimeException cause = new RuntimeException("port gone");
        RecoveryException ex = new RecoveryException(ErrorCategory.CONNECTION_LOSS, 3, cause);

        assertThat(ex.getMessage()).contains("3 attempt");
        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.getCategory()).isEqualTo(ErrorCategory.CONNECTION_LOSS);
        assertThat(ex.getCause()).isSameAs(cause);
    }
}
