package io.httpfixture.server.handler;

import io.httpfixture.core.coding.ContentCoding;
import io.httpfixture.core.envelope.Envelopes;
import io.httpfixture.server.adapter.RequestSnapshotAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.OutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /gzip}, {@code /deflate} and {@code /brotli}: the
 * {@code {headers, origin, <flag>: true}} envelope compressed with one
 * {@link ContentCoding}. The compressor is closed, and the payload
 * finished, before the handler returns.
 */
public final class EncodedHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(EncodedHandler.class);

    private final ContentCoding coding;
    private final RequestSnapshotAdapter adapter;

    public EncodedHandler(ContentCoding coding, RequestSnapshotAdapter adapter) {
        this.coding = coding;
        this.adapter = adapter;
    }

    @Override
    public void handle(Context ctx) throws IOException {
        byte[] payload = Envelopes.encoded(adapter.snapshot(ctx), coding).toBytes();
        OutputStream raw = ctx.res().getOutputStream();
        OutputStream compressed = coding.wrap(raw);

        ctx.status(200);
        ctx.contentType(JsonResponses.APPLICATION_JSON);
        ctx.header("Content-Encoding", coding.token());
        try (compressed) {
            compressed.write(payload);
        }
        LOG.debug("{}: {} bytes before {}", ctx.path(), payload.length, coding.token());
    }
}
