package io.httpfixture.server.adapter;

import io.httpfixture.core.model.QueryValues;
import io.httpfixture.core.model.RequestSnapshot;
import io.javalin.http.Context;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Enumeration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges Javalin's {@link Context} to the core {@link RequestSnapshot}.
 *
 * <p>
 * Header names are copied as received with their first value. Cookies are
 * read from the servlet request, so a repeated cookie name keeps its last
 * value. The query string is decoded by {@link QueryValues#parse(String)} to
 * preserve first-seen key order and repeated values.
 *
 * <p>
 * Thread-safe: all state is local to each invocation.
 */
public final class RequestSnapshotAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(RequestSnapshotAdapter.class);

    /**
     * Captures the request behind {@code ctx}. Reads the full request body.
     *
     * @param ctx the Javalin request context
     * @return an immutable snapshot
     */
    public RequestSnapshot snapshot(Context ctx) {
        HttpServletRequest req = ctx.req();
        RequestSnapshot.Builder builder = RequestSnapshot.builder()
                .remoteAddress(ctx.ip())
                .host(req.getHeader("Host"))
                .query(QueryValues.parse(ctx.queryString()))
                .body(ctx.bodyAsBytes());

        Enumeration<String> headerNames = req.getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                String value = req.getHeader(name);
                builder.header(name, value != null ? value : "");
            }
        }

        Cookie[] cookies = req.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                builder.cookie(cookie.getName(), cookie.getValue());
            }
        }

        RequestSnapshot snapshot = builder.build();
        LOG.debug("snapshot: {} {} → {}", ctx.method().name(), ctx.path(), snapshot);
        return snapshot;
    }
}
