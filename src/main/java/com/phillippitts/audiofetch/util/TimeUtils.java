package com.phillippitts.audiofetch.util;

import java.time.Duration;

/**
 * Elapsed-time helpers over {@link System#nanoTime()} readings.
 */
public final class TimeUtils {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Elapsed nanoseconds since {@code startNanos}, never negative.
     */
    public static long elapsedNanos(long startNanos) {
        return Math.max(0L, System.nanoTime() - startNanos);
    }

    /**
     * Elapsed milliseconds since {@code startNanos}, truncated.
     */
    public static long elapsedMillis(long startNanos) {
        return elapsedNanos(startNanos) / NANOS_PER_MILLI;
    }

    /** Formats a duration as whole seconds for user-facing messages, e.g. {@code "300s"}. */
    public static String seconds(Duration duration) {
        return duration.toSeconds() + "s";
    }
}
