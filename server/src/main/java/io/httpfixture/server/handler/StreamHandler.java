package io.httpfixture.server.handler;

import io.httpfixture.core.config.FixtureSettings;
import io.httpfixture.core.engine.Durations;
import io.httpfixture.core.envelope.Envelopes;
import io.httpfixture.server.adapter.RequestParams;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /stream/{n}}: {@code n} JSON lines {@code {"n", "time"}}, each
 * written after a pause of {@link FixtureSettings#streamInterval()} and
 * flushed on its own.
 */
public final class StreamHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(StreamHandler.class);

    private final Duration interval;

    public StreamHandler(FixtureSettings settings) {
        this.interval = settings.streamInterval();
    }

    @Override
    public void handle(Context ctx) throws IOException, InterruptedException {
        int n = RequestParams.pathInt(ctx, "n");
        LOG.debug("stream: n={}, interval={}", n, interval);

        ctx.status(200);
        ctx.contentType(JsonResponses.APPLICATION_JSON);
        OutputStream out = ctx.res().getOutputStream();
        for (int i = 0; i < n; i++) {
            Durations.sleep(interval);
            byte[] line = Envelopes.streamLine(i, Instant.now()).toLineBytes();
            if (!PacedWrites.writeAndFlush(out, line, ctx.path())) {
                return;
            }
        }
    }
}
