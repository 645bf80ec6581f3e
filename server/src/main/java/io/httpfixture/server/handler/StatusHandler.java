package io.httpfixture.server.handler;

import io.httpfixture.core.engine.StatusResponse;
import io.httpfixture.core.engine.StatusResponses;
import io.httpfixture.server.adapter.RequestParams;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * {@code /status/{code}} for any method: answers with the code from the
 * path and the canned headers/body of {@link StatusResponses}. Codes that
 * are not registered HTTP statuses are passed through as they are.
 */
public final class StatusHandler implements Handler {

    @Override
    public void handle(Context ctx) {
        StatusResponse response = StatusResponses.forCode(RequestParams.pathInt(ctx, "code"));
        response.headers().forEach(ctx::header);
        ctx.status(response.code());
        if (response.hasBody()) {
            ctx.contentType(response.contentType());
            ctx.result(response.bodyBytes());
        }
    }
}
