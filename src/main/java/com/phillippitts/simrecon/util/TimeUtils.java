package com.phillippitts.simrecon.util;

import java.time.Duration;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} timestamps.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * Truncating nanoseconds-to-milliseconds conversion.
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * @return time since {@code startNanos}, or {@link Duration#ZERO} if the clock was never started
     */
    public static Duration elapsed(long startNanos) {
        if (startNanos == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
