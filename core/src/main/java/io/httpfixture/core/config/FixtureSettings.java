package io.httpfixture.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Process-wide tunables handed to the endpoint handlers at construction.
 *
 * <p>
 * Immutable; two servers in the same JVM may run with independent settings.
 *
 * @param maxDelay       upper bound applied to {@code /delay/{n}}
 * @param streamInterval pause before each line written by {@code /stream/{n}}
 * @param chunkSize      buffer length used when generating {@code /bytes/{n}}
 */
public record FixtureSettings(Duration maxDelay, Duration streamInterval, int chunkSize) {

    /** Maximum delay for {@code /delay/{n}} unless configured otherwise. */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    /** Interval between {@code /stream/{n}} lines unless configured otherwise. */
    public static final Duration DEFAULT_STREAM_INTERVAL = Duration.ofSeconds(1);

    /** Buffer length for generated binary payloads (64 KiB). */
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    /** Settings with every tunable at its default. */
    public static final FixtureSettings DEFAULTS =
            new FixtureSettings(DEFAULT_MAX_DELAY, DEFAULT_STREAM_INTERVAL, DEFAULT_CHUNK_SIZE);

    public FixtureSettings {
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(streamInterval, "streamInterval");
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative: " + maxDelay);
        }
        if (streamInterval.isNegative()) {
            throw new IllegalArgumentException("streamInterval must not be negative: " + streamInterval);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
    }

    public FixtureSettings withMaxDelay(Duration maxDelay) {
        return new FixtureSettings(maxDelay, streamInterval, chunkSize);
    }

    public FixtureSettings withStreamInterval(Duration streamInterval) {
        return new FixtureSettings(maxDelay, streamInterval, chunkSize);
    }

    public FixtureSettings withChunkSize(int chunkSize) {
        return new FixtureSettings(maxDelay, streamInterval, chunkSize);
    }

    /**
     * Clamps a requested delay to {@link #maxDelay()}.
     *
     * @param requested the delay the client asked for
     * @return {@code min(requested, maxDelay)}
     */
    public Duration effectiveDelay(Duration requested) {
        return requested.compareTo(maxDelay) > 0 ? maxDelay : requested;
    }
}
