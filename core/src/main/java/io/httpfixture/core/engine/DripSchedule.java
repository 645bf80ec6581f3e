package io.httpfixture.core.engine;

import java.time.Duration;

/**
 * Pacing of {@code /drip}: {@code numBytes} single-byte writes, each preceded
 * by a pause of {@code interval}, so the body spans the requested duration.
 *
 * @param numBytes number of bytes to emit, {@code >= 0}
 * @param interval pause before each byte; zero when there is nothing to emit
 */
public record DripSchedule(int numBytes, Duration interval) {

    /** The byte every drip write emits. */
    public static final byte DRIP_BYTE = '*';

    public DripSchedule {
        if (numBytes < 0) {
            throw new IllegalArgumentException("numBytes must not be negative: " + numBytes);
        }
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative: " + interval);
        }
    }

    /**
     * Spreads {@code numBytes} writes evenly over {@code duration}.
     * {@code numBytes == 0} yields an empty schedule instead of dividing by zero.
     */
    public static DripSchedule of(int numBytes, Duration duration) {
        if (numBytes == 0) {
            return new DripSchedule(0, Duration.ZERO);
        }
        return new DripSchedule(numBytes, duration.dividedBy(numBytes));
    }

    /** True if nothing is emitted. */
    public boolean isEmpty() {
        return numBytes == 0;
    }

    /** Total time spent pausing across all writes. */
    public Duration total() {
        return interval.multipliedBy(numBytes);
    }
}
