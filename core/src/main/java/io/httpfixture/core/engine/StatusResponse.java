package io.httpfixture.core.engine;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Canned answer of {@code /status/{code}}.
 *
 * @param code        the status line code, passed through unvalidated
 * @param headers     extra response headers, in write order
 * @param contentType content type of {@code body}, or {@code null} when there is no body
 * @param body        fixed body text; empty for most codes
 */
public record StatusResponse(int code, Map<String, String> headers, String contentType, String body) {

    public StatusResponse {
        headers = Map.copyOf(headers);
        body = body != null ? body : "";
    }

    /** True if the response carries a body. */
    public boolean hasBody() {
        return !body.isEmpty();
    }

    /** Body as UTF-8 bytes. */
    public byte[] bodyBytes() {
        return body.getBytes(StandardCharsets.UTF_8);
    }
}
