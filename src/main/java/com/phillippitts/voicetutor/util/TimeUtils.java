package com.phillippitts.voicetutor.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed-time calculations used by queue latency tracking and
 * idle-context expiry.
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns true when {@code since} lies at least {@code maxAge} before {@code now}.
     *
     * @param since reference instant (null is treated as "never", i.e. not expired)
     * @param maxAge age threshold
     * @param now current instant
     */
    public static boolean isOlderThan(Instant since, Duration maxAge, Instant now) {
        if (since == null) {
            return false;
        }
        return Duration.between(since, now).compareTo(maxAge) >= 0;
    }
}
