package io.httpfixture.server.app;

import io.httpfixture.core.error.FixtureException;
import io.httpfixture.server.handler.JsonResponses;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps handler exceptions to the {@code {"error":{"message":...}}} envelope.
 *
 * <p>
 * {@link FixtureException}s carry their own status. Anything else is a bug
 * or an environment failure: logged at ERROR and answered with {@code 500}.
 * Once a streaming handler has committed the response nothing can be
 * rewritten, so the failure is only logged.
 */
final class ExceptionMappers {

    private static final Logger LOG = LoggerFactory.getLogger(ExceptionMappers.class);

    private ExceptionMappers() {
        // utility class
    }

    static void register(Javalin app) {
        app.exception(FixtureException.class, ExceptionMappers::fixtureFailure);
        app.exception(Exception.class, ExceptionMappers::unexpectedFailure);
    }

    static void fixtureFailure(FixtureException e, Context ctx) {
        if (ctx.res().isCommitted()) {
            LOG.debug("{} failed after response was committed: {}", ctx.path(), e.getMessage());
            return;
        }
        LOG.debug("{} {} → {}: {}", ctx.method().name(), ctx.path(), e.status(), e.getMessage());
        JsonResponses.error(ctx, e.status(), e.getMessage());
    }

    static void unexpectedFailure(Exception e, Context ctx) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (ctx.res().isCommitted()) {
            LOG.debug("{} failed after response was committed: {}", ctx.path(), e.toString());
            return;
        }
        LOG.error("Unhandled failure on {} {}", ctx.method().name(), ctx.path(), e);
        JsonResponses.error(ctx, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
