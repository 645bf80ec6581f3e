package io.httpfixture.server.handler;

import io.httpfixture.core.envelope.Envelopes;
import io.httpfixture.server.adapter.RequestParams;
import io.httpfixture.server.adapter.RequestSnapshotAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * {@code /cache} and {@code /cache/{n}}.
 *
 * <p>
 * {@code /cache} answers a conditional request ({@code If-Modified-Since}
 * or {@code If-None-Match}) with an empty {@code 304}, anything else like
 * {@code /get}. {@code /cache/{n}} adds
 * {@code Cache-Control: public, max-age=n} to the {@code /get} response.
 */
public final class CacheHandler implements Handler {

    private final RequestSnapshotAdapter adapter;
    private final boolean maxAgeFromPath;

    private CacheHandler(RequestSnapshotAdapter adapter, boolean maxAgeFromPath) {
        this.adapter = adapter;
        this.maxAgeFromPath = maxAgeFromPath;
    }

    /** Handler for {@code /cache}. */
    public static CacheHandler conditional(RequestSnapshotAdapter adapter) {
        return new CacheHandler(adapter, false);
    }

    /** Handler for {@code /cache/{n}}. */
    public static CacheHandler maxAge(RequestSnapshotAdapter adapter) {
        return new CacheHandler(adapter, true);
    }

    @Override
    public void handle(Context ctx) {
        if (maxAgeFromPath) {
            int seconds = RequestParams.pathInt(ctx, "n");
            ctx.header("Cache-Control", "public, max-age=" + seconds);
        } else if (ctx.header("If-Modified-Since") != null || ctx.header("If-None-Match") != null) {
            ctx.status(304);
            return;
        }
        JsonResponses.ok(ctx, Envelopes.get(adapter.snapshot(ctx)));
    }
}
