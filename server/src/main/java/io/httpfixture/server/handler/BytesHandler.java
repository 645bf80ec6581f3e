package io.httpfixture.server.handler;

import io.httpfixture.core.config.FixtureSettings;
import io.httpfixture.core.engine.RandomBytes;
import io.httpfixture.server.adapter.RequestParams;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.OutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /bytes/{n}[?seed=long]}: exactly {@code n} pseudo-random bytes,
 * streamed through a buffer of {@link FixtureSettings#chunkSize()} bytes.
 * Without a seed the output differs from call to call.
 */
public final class BytesHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(BytesHandler.class);

    static final String APPLICATION_OCTET_STREAM = "application/octet-stream";

    private final RandomBytes generator;

    public BytesHandler(FixtureSettings settings) {
        this.generator = new RandomBytes(settings.chunkSize());
    }

    @Override
    public void handle(Context ctx) throws IOException {
        int n = RequestParams.pathInt(ctx, "n");
        long seed = RequestParams.optionalQueryLong(ctx, "seed").orElseGet(RandomBytes::timeSeed);
        LOG.debug("bytes: n={}, seed={}", n, seed);

        ctx.status(200);
        ctx.contentType(APPLICATION_OCTET_STREAM);
        ctx.res().setContentLengthLong(n);
        OutputStream out = ctx.res().getOutputStream();
        generator.writeTo(out, n, seed);
        out.flush();
    }
}
