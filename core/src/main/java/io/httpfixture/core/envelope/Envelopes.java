package io.httpfixture.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import io.httpfixture.core.coding.ContentCoding;
import io.httpfixture.core.error.BodyParseException;
import io.httpfixture.core.model.QueryValues;
import io.httpfixture.core.model.RequestSnapshot;
import java.io.IOException;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * The envelope shape of every JSON endpoint, built from a
 * {@link RequestSnapshot}.
 *
 * <p>
 * Thread-safe; all methods are stateless.
 */
public final class Envelopes {

    private static final ObjectReader STRICT_READER =
            Envelope.MAPPER.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private Envelopes() {
        // utility class
    }

    /** {@code /ip}: {@code {origin}}. */
    public static Envelope ip(RequestSnapshot snapshot) {
        return Envelope.create().origin(snapshot);
    }

    /** {@code /user-agent}: {@code {"user-agent"}}. */
    public static Envelope userAgent(RequestSnapshot snapshot) {
        String userAgent = snapshot.headerIgnoreCase("User-Agent");
        return Envelope.create().put("user-agent", userAgent != null ? userAgent : "");
    }

    /** {@code /headers}: {@code {headers}}. */
    public static Envelope headers(RequestSnapshot snapshot) {
        return Envelope.create().headers(snapshot);
    }

    /** {@code /get} and everything that delegates to it: {@code {headers, origin, args}}. */
    public static Envelope get(RequestSnapshot snapshot) {
        return Envelope.create().headers(snapshot).origin(snapshot).args(snapshot);
    }

    /**
     * {@code /post}: {@code {headers, origin, args, data, form, json}}.
     *
     * <p>
     * {@code form} holds the flattened body when it is url-encoded, otherwise
     * an empty object. {@code json} holds the parsed body when
     * {@code Content-Type} contains "json", otherwise {@code null}.
     *
     * @throws BodyParseException if the content type says JSON but the body
     *                            is not a single valid JSON value
     */
    public static Envelope post(RequestSnapshot snapshot) {
        String contentType = snapshot.headerIgnoreCase("Content-Type");
        String lowerType = contentType != null ? contentType.toLowerCase(Locale.ROOT) : "";

        Map<String, ?> form = lowerType.contains("application/x-www-form-urlencoded")
                ? QueryValues.flatten(QueryValues.parse(snapshot.bodyText()))
                : Map.of();

        JsonNode json = null;
        if (lowerType.contains("json")) {
            json = parseJson(snapshot.body());
        }

        return Envelope.create()
                .headers(snapshot)
                .origin(snapshot)
                .args(snapshot)
                .put("data", snapshot.bodyText())
                .object("form", form)
                .set("json", json);
    }

    /** {@code /cookies}: {@code {cookies}}. */
    public static Envelope cookies(RequestSnapshot snapshot) {
        return Envelope.create().object("cookies", snapshot.cookies());
    }

    /** {@code /gzip}, {@code /deflate}, {@code /brotli}: {@code {headers, origin, <flag>: true}}. */
    public static Envelope encoded(RequestSnapshot snapshot, ContentCoding coding) {
        return Envelope.create().headers(snapshot).origin(snapshot).put(coding.flagField(), true);
    }

    /** One line of {@code /stream/{n}}: {@code {"n": i, "time": "<ISO-8601 UTC>"}}. */
    public static Envelope streamLine(int n, Instant time) {
        return Envelope.create().put("n", n).put("time", time.toString());
    }

    /** Successful Basic-Auth check: {@code {authenticated: true, user}}. */
    public static Envelope authenticated(String user) {
        return Envelope.create().put("authenticated", true).put("user", user);
    }

    private static JsonNode parseJson(byte[] body) {
        JsonNode parsed;
        try {
            parsed = STRICT_READER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BodyParseException("failed to read body: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BodyParseException("failed to read body: " + e.getMessage(), e);
        }
        if (parsed == null || parsed.isMissingNode()) {
            throw new BodyParseException("failed to read body: no JSON content", null);
        }
        return parsed;
    }
}
