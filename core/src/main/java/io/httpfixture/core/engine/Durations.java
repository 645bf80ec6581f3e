package io.httpfixture.core.engine;

import java.time.Duration;

/** Conversions and sleeping for the timed endpoints. */
public final class Durations {

    private Durations() {
        // utility class
    }

    /**
     * Converts fractional seconds to a {@link Duration}, truncated to
     * millisecond resolution.
     *
     * @param seconds a non-negative number of seconds, e.g. {@code 0.5}
     */
    public static Duration ofSeconds(double seconds) {
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new IllegalArgumentException("seconds must be a non-negative number: " + seconds);
        }
        return Duration.ofMillis((long) (seconds * 1000));
    }

    /**
     * Blocks the calling thread for {@code duration}; returns at once for zero.
     *
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    public static void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    }
}
