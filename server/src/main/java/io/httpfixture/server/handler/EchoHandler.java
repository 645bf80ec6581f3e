package io.httpfixture.server.handler;

import io.httpfixture.core.envelope.Envelope;
import io.httpfixture.core.model.RequestSnapshot;
import io.httpfixture.server.adapter.RequestSnapshotAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.function.Function;

/**
 * Echoes part of the request back as a {@code 200} JSON envelope.
 *
 * <p>
 * One instance per echo endpoint, parameterized by the envelope shape:
 * {@code /ip}, {@code /user-agent}, {@code /headers}, {@code /get},
 * {@code /post} and {@code /cookies} all differ only in which
 * {@link io.httpfixture.core.envelope.Envelopes} factory they use.
 */
public final class EchoHandler implements Handler {

    private final RequestSnapshotAdapter adapter;
    private final Function<RequestSnapshot, Envelope> shape;

    public EchoHandler(RequestSnapshotAdapter adapter, Function<RequestSnapshot, Envelope> shape) {
        this.adapter = adapter;
        this.shape = shape;
    }

    @Override
    public void handle(Context ctx) {
        JsonResponses.ok(ctx, shape.apply(adapter.snapshot(ctx)));
    }
}
