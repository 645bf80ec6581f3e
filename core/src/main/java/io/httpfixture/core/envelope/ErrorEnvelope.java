package io.httpfixture.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Body written with a {@code 500} (or the status of a mapped exception)
 * whenever an endpoint cannot produce its regular response:
 *
 * <pre>{@code
 * { "error": { "message": "failed to read body: ..." } }
 * }</pre>
 */
public final class ErrorEnvelope {

    private ErrorEnvelope() {
        // utility class
    }

    /**
     * Builds the error JSON.
     *
     * @param message human-readable description; {@code null} becomes an empty string
     * @return a new {@link ObjectNode}
     */
    public static ObjectNode of(String message) {
        ObjectNode root = Envelope.MAPPER.createObjectNode();
        root.putObject("error").put("message", message != null ? message : "");
        return root;
    }

    /**
     * Serializes the error JSON as indented UTF-8.
     *
     * @throws JsonProcessingException if serialization fails
     */
    public static byte[] toBytes(String message) throws JsonProcessingException {
        return Envelope.serialize(of(message));
    }
}
