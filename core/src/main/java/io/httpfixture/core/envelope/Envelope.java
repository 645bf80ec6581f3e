package io.httpfixture.core.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.httpfixture.core.model.QueryValues;
import io.httpfixture.core.model.RequestSnapshot;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON response body under construction.
 *
 * <p>
 * Responses are composed from a few shared fragments ({@code headers},
 * {@code origin}, {@code args}) plus endpoint-specific fields, in the order
 * the fragments are added:
 *
 * <pre>{@code
 * Envelope.create().headers(snapshot).origin(snapshot).args(snapshot).toBytes();
 * }</pre>
 *
 * <p>
 * Not thread-safe; build one per request.
 */
public final class Envelope {

    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();

    private final ObjectNode node;

    private Envelope(ObjectNode node) {
        this.node = node;
    }

    /** Starts an empty envelope. */
    public static Envelope create() {
        return new Envelope(MAPPER.createObjectNode());
    }

    /** Adds {@code headers}: first value per header name. */
    public Envelope headers(RequestSnapshot snapshot) {
        return object("headers", snapshot.headers());
    }

    /** Adds {@code origin}: the caller's IP address. */
    public Envelope origin(RequestSnapshot snapshot) {
        node.put("origin", snapshot.remoteAddress());
        return this;
    }

    /** Adds {@code args}: the flattened query parameters. */
    public Envelope args(RequestSnapshot snapshot) {
        return object("args", QueryValues.flatten(snapshot.query()));
    }

    /** Adds a string field. */
    public Envelope put(String field, String value) {
        node.put(field, value);
        return this;
    }

    /** Adds an integer field. */
    public Envelope put(String field, int value) {
        node.put(field, value);
        return this;
    }

    /** Adds a boolean field. */
    public Envelope put(String field, boolean value) {
        node.put(field, value);
        return this;
    }

    /** Adds an arbitrary JSON value; {@code null} becomes JSON {@code null}. */
    public Envelope set(String field, JsonNode value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.set(field, value);
        }
        return this;
    }

    /** Adds a map as a nested JSON object, keeping the map's iteration order. */
    public Envelope object(String field, Map<String, ?> values) {
        node.set(field, MAPPER.valueToTree(values));
        return this;
    }

    /** A copy of the JSON built so far. */
    public ObjectNode toJson() {
        return node.deepCopy();
    }

    /**
     * Serializes the envelope as indented UTF-8 JSON followed by a newline.
     *
     * @throws JsonProcessingException if serialization fails
     */
    public byte[] toBytes() throws JsonProcessingException {
        return serialize(node);
    }

    /**
     * Serializes the envelope as compact single-line JSON followed by a
     * newline, the framing of line-delimited streams.
     *
     * @throws JsonProcessingException if serialization fails
     */
    public byte[] toLineBytes() throws JsonProcessingException {
        return (MAPPER.writeValueAsString(node) + "\n").getBytes(StandardCharsets.UTF_8);
    }

    static byte[] serialize(JsonNode value) throws JsonProcessingException {
        String text = PRETTY.writeValueAsString(value) + "\n";
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
