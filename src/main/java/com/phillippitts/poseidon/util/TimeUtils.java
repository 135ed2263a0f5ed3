package com.phillippitts.poseidon.util;

import java.time.Duration;

/**
 * Utility methods for elapsed-time measurement and timeout arithmetic.
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
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a timeout to milliseconds, substituting the fallback for null, zero or negative values.
     *
     * @param timeout    configured timeout (may be null)
     * @param fallbackMs value used when the timeout is unusable
     * @return positive millisecond value
     */
    public static long positiveMillis(Duration timeout, long fallbackMs) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return fallbackMs;
        }
        return timeout.toMillis();
    }
}
