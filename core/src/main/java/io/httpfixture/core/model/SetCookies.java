package io.httpfixture.core.model;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@code Set-Cookie} header values from arbitrary query input.
 *
 * <p>
 * Names must be RFC 7230 tokens once CR and LF are replaced by {@code -};
 * anything else yields {@link Optional#empty()} and no header. Value bytes
 * outside the RFC 6265 cookie-octet range are dropped, and a value that
 * still contains a space or a comma is sent double-quoted.
 */
public final class SetCookies {

    private static final Logger LOG = LoggerFactory.getLogger(SetCookies.class);

    private static final String SEPARATORS = "()<>@,;:\\\"/[]?={} \t";
    private static final String EPOCH = "Thu, 01 Jan 1970 00:00:00 GMT";

    private SetCookies() {
        // utility
    }

    /** {@code name=value; Path=/}, or empty if {@code name} is not a valid cookie name. */
    public static Optional<String> set(String name, String value) {
        return validName(name).map(valid -> valid + "=" + sanitizeValue(value) + "; Path=/");
    }

    /** An already-expired cookie that makes clients drop {@code name}. */
    public static Optional<String> expire(String name) {
        return validName(name).map(valid -> valid + "=; Path=/; Expires=" + EPOCH + "; Max-Age=0");
    }

    static Optional<String> validName(String name) {
        String sanitized = name.replace('\n', '-').replace('\r', '-');
        if (sanitized.isEmpty() || !sanitized.chars().allMatch(SetCookies::isTokenChar)) {
            LOG.debug("skipping cookie with invalid name '{}'", name);
            return Optional.empty();
        }
        return Optional.of(sanitized);
    }

    static String sanitizeValue(String value) {
        StringBuilder kept = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isValueChar(c)) {
                kept.append(c);
            }
        }
        if (kept.length() != value.length()) {
            LOG.debug("dropped {} invalid byte(s) from cookie value", value.length() - kept.length());
        }
        String sanitized = kept.toString();
        if (sanitized.indexOf(' ') >= 0 || sanitized.indexOf(',') >= 0) {
            return '"' + sanitized + '"';
        }
        return sanitized;
    }

    private static boolean isTokenChar(int c) {
        return c > 0x20 && c < 0x7f && SEPARATORS.indexOf(c) < 0;
    }

    private static boolean isValueChar(char c) {
        return c >= 0x20 && c < 0x7f && c != '"' && c != ';' && c != '\\';
    }
}
