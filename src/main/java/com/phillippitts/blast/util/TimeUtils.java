package com.phillippitts.blast.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Provides convenient methods for converting between nanoseconds and milliseconds,
 * commonly used for performance timing with {@link System#nanoTime()}, and for measuring
 * gaps between wall-clock instants taken from an injected {@link java.time.Clock}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to fractional milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds
     */
    public static double nanosToMillis(long nanos) {
        return nanos / (double) NANOS_PER_MILLI;
    }

    /**
     * Fractional milliseconds between two instants (negative if {@code to} precedes {@code from}).
     *
     * @param from earlier instant
     * @param to later instant
     * @return elapsed milliseconds
     */
    public static double millisBetween(Instant from, Instant to) {
        return nanosToMillis(Duration.between(from, to).toNanos());
    }

    /**
     * Converts fractional seconds to a {@link Duration} with nanosecond precision.
     *
     * @param seconds seconds, may be fractional
     * @return equivalent duration
     */
    public static Duration secondsToDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }

    /**
     * Rounds a value to three decimal places for reporting.
     */
    public static double round3(double value) {
        return Math.round(value * 1000d) / 1000d;
    }
}
