package io.httpfixture.server.handler;

import io.httpfixture.core.model.QueryValues;
import io.httpfixture.core.model.SetCookies;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /cookies/set} and {@code /cookies/delete}. Both answer with a
 * {@code 302} back to {@code /cookies}, so a client with a cookie jar sees
 * the effect of its own request.
 */
public final class CookieHandlers {

    private static final Logger LOG = LoggerFactory.getLogger(CookieHandlers.class);

    static final String COOKIES_PATH = "/cookies";

    private CookieHandlers() {
        // factory holder
    }

    /** {@code /cookies/set?k=v...}: one {@code Set-Cookie k=v; Path=/} per valid key, first value wins. */
    public static Handler set() {
        return ctx -> {
            for (Map.Entry<String, List<String>> entry : query(ctx).entrySet()) {
                SetCookies.set(entry.getKey(), entry.getValue().get(0)).ifPresent(header -> addSetCookie(ctx, header));
            }
            redirectToCookies(ctx);
        };
    }

    /** {@code /cookies/delete?k...}: an expiring {@code Set-Cookie} per key. */
    public static Handler delete() {
        return ctx -> {
            for (String name : query(ctx).keySet()) {
                SetCookies.expire(name).ifPresent(header -> addSetCookie(ctx, header));
            }
            redirectToCookies(ctx);
        };
    }

    private static Map<String, List<String>> query(Context ctx) {
        Map<String, List<String>> query = QueryValues.parse(ctx.queryString());
        LOG.debug("{}: {}", ctx.path(), query.keySet());
        return query;
    }

    private static void addSetCookie(Context ctx, String header) {
        ctx.res().addHeader("Set-Cookie", header);
    }

    private static void redirectToCookies(Context ctx) {
        ctx.header("Location", COOKIES_PATH);
        ctx.status(302);
    }
}
