package io.httpfixture.server.handler;

import java.io.IOException;
import java.io.OutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-and-flush step shared by the paced endpoints ({@code /stream},
 * {@code /drip}). A failed write means the client went away; the caller
 * stops pacing instead of sleeping through the remaining schedule.
 */
final class PacedWrites {

    private static final Logger LOG = LoggerFactory.getLogger(PacedWrites.class);

    private PacedWrites() {
        // utility class
    }

    /**
     * Writes {@code bytes} and flushes them to the client.
     *
     * @return {@code false} if the connection is gone
     */
    static boolean writeAndFlush(OutputStream out, byte[] bytes, String path) {
        try {
            out.write(bytes);
            out.flush();
            return true;
        } catch (IOException e) {
            LOG.debug("Client disconnected from {}: {}", path, e.getMessage());
            return false;
        }
    }
}
