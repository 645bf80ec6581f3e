package io.httpfixture.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Username and password carried by an HTTP Basic {@code Authorization}
 * header.
 *
 * @param username the user part, before the first {@code :}
 * @param password everything after the first {@code :}
 */
public record BasicCredentials(String username, String password) {

    private static final String SCHEME = "Basic ";

    /**
     * Parses an {@code Authorization} header value of the form
     * {@code Basic base64(user:pass)}. The scheme name is matched ignoring
     * case.
     *
     * @param authorization the header value; may be {@code null}
     * @return the credentials, or empty if the header is absent, uses another
     *         scheme, or is not valid Base64 / lacks the {@code :} separator
     */
    public static Optional<BasicCredentials> parse(String authorization) {
        if (authorization == null || authorization.length() < SCHEME.length()) {
            return Optional.empty();
        }
        if (!authorization.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            return Optional.empty();
        }
        String decoded;
        try {
            byte[] raw = Base64.getDecoder().decode(authorization.substring(SCHEME.length()).trim());
            decoded = new String(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
    }

    /** True if both parts equal the expected values exactly. */
    public boolean matches(String expectedUser, String expectedPassword) {
        return username.equals(expectedUser) && password.equals(expectedPassword);
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=***]";
    }
}
