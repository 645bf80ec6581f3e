package io.httpfixture.server.handler;

import io.httpfixture.core.envelope.Envelopes;
import io.httpfixture.core.model.BasicCredentials;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code /basic-auth/{user}/{pass}} and
 * {@code /hidden-basic-auth/{user}/{pass}}: accepts exactly the credentials
 * named in the path.
 *
 * <p>
 * On failure the visible variant challenges with {@code 401} and
 * {@code WWW-Authenticate}; the hidden variant answers {@code 404}.
 */
public final class BasicAuthHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(BasicAuthHandler.class);

    static final String CHALLENGE = "Basic realm=\"Fake Realm\"";

    private final int failureStatus;

    private BasicAuthHandler(int failureStatus) {
        this.failureStatus = failureStatus;
    }

    /** Handler for {@code /basic-auth/{user}/{pass}}. */
    public static BasicAuthHandler challenging() {
        return new BasicAuthHandler(401);
    }

    /** Handler for {@code /hidden-basic-auth/{user}/{pass}}. */
    public static BasicAuthHandler hidden() {
        return new BasicAuthHandler(404);
    }

    @Override
    public void handle(Context ctx) {
        String user = ctx.pathParam("user");
        String pass = ctx.pathParam("pass");
        Optional<BasicCredentials> credentials = BasicCredentials.parse(ctx.header("Authorization"));

        if (credentials.isPresent() && credentials.get().matches(user, pass)) {
            JsonResponses.ok(ctx, Envelopes.authenticated(user));
            return;
        }

        LOG.debug("{}: rejected {}", ctx.path(), credentials.map(Object::toString).orElse("missing credentials"));
        if (failureStatus == 401) {
            ctx.header("WWW-Authenticate", CHALLENGE);
        }
        ctx.status(failureStatus);
    }
}
