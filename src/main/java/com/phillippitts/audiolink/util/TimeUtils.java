package com.phillippitts.audiolink.util;

import java.util.concurrent.TimeUnit;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} stopwatches.
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return nanoseconds elapsed since {@code startNanos}
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return whole milliseconds elapsed since {@code startNanos}
     */
    public static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(elapsedNanos(startNanos));
    }
}
