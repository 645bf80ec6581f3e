package io.httpfixture.server.handler;

import io.httpfixture.server.adapter.RequestParams;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * {@code /redirect-to?url=...}: a single {@code 302} to the decoded
 * {@code url} value. Scheme and host are not checked.
 */
public final class RedirectToHandler implements Handler {

    @Override
    public void handle(Context ctx) {
        ctx.header("Location", RequestParams.requiredQuery(ctx, "url"));
        ctx.status(302);
    }
}
