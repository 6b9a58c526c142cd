package com.phillippitts.catalogintel.util;

import java.time.Duration;

/**
 * Conversions between nanosecond timer readings and milliseconds.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} reading.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts a millisecond setting to a duration; zero or negative means "no limit" and maps to null.
     */
    public static Duration millisOrNull(long millis) {
        return millis <= 0 ? null : Duration.ofMillis(millis);
    }
}
