package io.httpfixture.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.httpfixture.core.envelope.Envelope;
import io.httpfixture.core.envelope.ErrorEnvelope;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes envelopes and error envelopes to a Javalin {@link Context}.
 *
 * <p>
 * A failure to serialize the envelope is answered with a {@code 500} error
 * envelope. If that second write fails as well, the failure is logged and
 * the bare status is sent.
 */
public final class JsonResponses {

    private static final Logger LOG = LoggerFactory.getLogger(JsonResponses.class);

    static final String APPLICATION_JSON = "application/json";

    private JsonResponses() {
        // utility class
    }

    /** Writes {@code envelope} as indented JSON with status {@code 200}. */
    public static void ok(Context ctx, Envelope envelope) {
        write(ctx, 200, envelope);
    }

    /** Writes {@code envelope} as indented JSON with the given status. */
    public static void write(Context ctx, int status, Envelope envelope) {
        byte[] body;
        try {
            body = envelope.toBytes();
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to write json for {}: {}", ctx.path(), e.getOriginalMessage());
            error(ctx, 500, "failed to write json: " + e.getOriginalMessage());
            return;
        }
        ctx.status(status);
        ctx.contentType(APPLICATION_JSON);
        ctx.result(body);
    }

    /** Writes {@code {"error":{"message":...}}} with the given status. */
    public static void error(Context ctx, int status, String message) {
        ctx.status(status);
        try {
            byte[] body = ErrorEnvelope.toBytes(message);
            ctx.contentType(APPLICATION_JSON);
            ctx.result(body);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to write error envelope for {}", ctx.path(), e);
        }
    }
}
