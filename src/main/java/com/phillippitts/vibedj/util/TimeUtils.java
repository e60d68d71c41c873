package com.phillippitts.vibedj.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed time calculations.
 *
 * <p>Nano-based helpers are used for latency timing with {@link System#nanoTime()};
 * instant-based helpers are used for wall-clock history and plan arithmetic.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double MILLIS_PER_MINUTE = 60_000.0;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Fractional minutes between two instants (negative if {@code to} is before {@code from}).
     */
    public static double minutesBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_MINUTE;
    }

    /**
     * Fractional hours between two instants (negative if {@code to} is before {@code from}).
     */
    public static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }
}
