package io.httpfixture.server.handler;

import io.httpfixture.core.config.FixtureSettings;
import io.httpfixture.core.engine.Durations;
import io.httpfixture.core.envelope.Envelopes;
import io.httpfixture.server.adapter.RequestParams;
import io.httpfixture.server.adapter.RequestSnapshotAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /delay/{n}}: sleeps {@code min(n, maxDelay)} seconds, at
 * millisecond resolution, then answers exactly like {@code /get}.
 *
 * <p>
 * Only the thread serving this request is blocked.
 */
public final class DelayHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(DelayHandler.class);

    private final FixtureSettings settings;
    private final RequestSnapshotAdapter adapter;

    public DelayHandler(FixtureSettings settings, RequestSnapshotAdapter adapter) {
        this.settings = settings;
        this.adapter = adapter;
    }

    @Override
    public void handle(Context ctx) throws InterruptedException {
        Duration requested = Durations.ofSeconds(RequestParams.pathSeconds(ctx, "n"));
        Duration delay = settings.effectiveDelay(requested);
        LOG.debug("delay: requested={}, effective={}", requested, delay);
        Durations.sleep(delay);
        JsonResponses.ok(ctx, Envelopes.get(adapter.snapshot(ctx)));
    }
}
