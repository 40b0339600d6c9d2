package com.phillippitts.modelrelay.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed-time and age calculations.
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
     * Returns true when {@code since} lies strictly more than {@code maxAge} before {@code now}.
     */
    public static boolean isOlderThan(Instant since, Instant now, Duration maxAge) {
        return Duration.between(since, now).compareTo(maxAge) > 0;
    }

    /**
     * Nanoseconds left until {@code deadlineNanos}, never negative.
     */
    public static long remainingNanos(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }
}
