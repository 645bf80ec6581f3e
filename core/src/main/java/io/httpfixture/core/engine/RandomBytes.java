package io.httpfixture.core.engine;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seeded pseudo-random payload generator behind {@code /bytes/{n}}.
 *
 * <p>
 * Output is produced through a buffer of at most {@code chunkSize} bytes, so
 * memory use does not grow with {@code n}. The same seed and chunk size
 * always produce the same bytes. Each call creates its own {@link Random};
 * instances of this class hold no mutable state and may be shared.
 */
public final class RandomBytes {

    private static final Logger LOG = LoggerFactory.getLogger(RandomBytes.class);

    private final int chunkSize;

    public RandomBytes(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /** Seed derived from the current epoch time in nanoseconds. */
    public static long timeSeed() {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    /**
     * Writes exactly {@code n} pseudo-random bytes to {@code out}.
     *
     * @param out  destination; not flushed or closed
     * @param n    number of bytes, {@code >= 0}
     * @param seed generator seed
     * @throws IOException if writing fails
     */
    public void writeTo(OutputStream out, long n, long seed) throws IOException {
        if (n < 0) {
            throw new IllegalArgumentException("byte count must not be negative: " + n);
        }
        if (n == 0) {
            return;
        }
        LOG.debug("generating {} bytes: seed={}, chunkSize={}", n, seed, chunkSize);
        Random random = new Random(seed);
        byte[] buffer = new byte[(int) Math.min(chunkSize, n)];
        long remaining = n;
        while (remaining > 0) {
            random.nextBytes(buffer);
            int length = (int) Math.min(buffer.length, remaining);
            out.write(buffer, 0, length);
            remaining -= length;
        }
    }

    /** Buffer length used per write. */
    public int chunkSize() {
        return chunkSize;
    }
}
