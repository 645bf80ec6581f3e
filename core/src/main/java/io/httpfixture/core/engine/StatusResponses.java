package io.httpfixture.core.engine;

import java.util.Map;

/**
 * Maps a numeric status code to the response {@code /status/{code}} writes.
 *
 * <p>
 * Redirect codes point at {@code /redirect/1}, {@code 401} carries a Basic
 * challenge, and {@code 402}, {@code 406} and {@code 418} come with a fixed
 * body. Every other integer, registered or not, is answered with that code
 * and an empty body.
 */
public final class StatusResponses {

    static final String REDIRECT_TARGET = "/redirect/1";
    static final String BASIC_CHALLENGE = "Basic realm=\"Fake Realm\"";

    static final String PAYMENT_REQUIRED_BODY = "Fuck you, pay me!";
    static final String PAYMENT_REQUIRED_INFO = "http://vimeo.com/22053820";

    static final String NOT_ACCEPTABLE_BODY = "{\"message\": \"Client did not request a supported media type.\", "
            + "\"accept\": [\"image/webp\", \"image/svg+xml\", \"image/jpeg\", \"image/png\", \"image/*\"]}";

    static final String TEAPOT_INFO = "http://tools.ietf.org/html/rfc2324";
    static final String TEAPOT_BODY = "\n"
            + "    -=[ teapot ]=-\n"
            + "\n"
            + "       _...._\n"
            + "     .'  _ _ '.\n"
            + "    | .\"  ^  \". _,\n"
            + "    \\_;'\"---\"'|//\n"
            + "      |       ;/\n"
            + "      \\_     _/\n"
            + "        '\"\"\"'\n";

    private StatusResponses() {
        // utility class
    }

    /**
     * Looks up the canned response for {@code code}.
     *
     * @param code any integer; not checked against the registered status codes
     * @return the response to write
     */
    public static StatusResponse forCode(int code) {
        return switch (code) {
            case 301, 302, 303, 305, 307 -> new StatusResponse(code, Map.of("Location", REDIRECT_TARGET), null, "");
            case 401 -> new StatusResponse(code, Map.of("WWW-Authenticate", BASIC_CHALLENGE), null, "");
            case 402 -> new StatusResponse(
                    code, Map.of("x-more-info", PAYMENT_REQUIRED_INFO), "text/plain", PAYMENT_REQUIRED_BODY);
            case 406 -> new StatusResponse(code, Map.of(), "application/json", NOT_ACCEPTABLE_BODY);
            case 418 -> new StatusResponse(code, Map.of("x-more-info", TEAPOT_INFO), "text/plain", TEAPOT_BODY);
            default -> new StatusResponse(code, Map.of(), null, "");
        };
    }
}
