package io.httpfixture.server.handler;

import io.httpfixture.core.engine.RedirectChain;
import io.httpfixture.server.adapter.RequestParams;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /redirect/{n}} and {@code /absolute-redirect/{n}}: a {@code 302}
 * to hop {@code n - 1}, or to {@code /get} once {@code n <= 1}.
 *
 * <p>
 * The absolute variant prefixes the location with {@code http://} and the
 * request's {@code Host}, or with the server name and port the request
 * arrived on when it carries none (HTTP/1.0).
 */
public final class RedirectHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(RedirectHandler.class);

    private final RedirectChain chain;
    private final boolean absolute;

    private RedirectHandler(RedirectChain chain, boolean absolute) {
        this.chain = chain;
        this.absolute = absolute;
    }

    /** Handler for {@code /redirect/{n}}. */
    public static RedirectHandler relative() {
        return new RedirectHandler(RedirectChain.RELATIVE, false);
    }

    /** Handler for {@code /absolute-redirect/{n}}. */
    public static RedirectHandler absolute() {
        return new RedirectHandler(RedirectChain.ABSOLUTE, true);
    }

    @Override
    public void handle(Context ctx) {
        int n = RequestParams.pathInt(ctx, "n");
        String location = absolute ? chain.nextAbsolute(host(ctx), n) : chain.next(n);
        LOG.debug("redirect {} → {}", n, location);
        ctx.header("Location", location);
        ctx.status(302);
    }

    private static String host(Context ctx) {
        String host = ctx.header("Host");
        if (host != null && !host.isBlank()) {
            return host;
        }
        return ctx.req().getServerName() + ":" + ctx.req().getServerPort();
    }
}
