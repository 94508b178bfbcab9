package com.phillippitts.convocapture.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Session clocks are taken from {@link System#nanoTime()} so elapsed offsets are
 * monotonic even if the wall clock is adjusted mid-session.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one second.
     */
    public static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed seconds (fractional) since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed seconds since startNanos
     */
    public static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_SECOND;
    }

    /**
     * Formats an elapsed offset as {@code HH:MM:SS}. Fractions are truncated; negative
     * input is treated as zero. Hours are not wrapped at 24.
     *
     * @param seconds elapsed seconds
     * @return zero-padded {@code HH:MM:SS}
     */
    public static String formatElapsed(double seconds) {
        long total = seconds <= 0 ? 0 : (long) seconds;
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;
        return String.format("%02d:%02d:%02d", hours, minutes, secs);
    }
}
