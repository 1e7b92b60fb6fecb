package com.phillippitts.blast.service.recovery;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread between retries. Replaced in tests to avoid real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
