package io.httpfixture.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only projection of an inbound request, built once per request by the
 * server adapter and handed to the endpoint logic.
 *
 * <p>
 * Header and cookie names are kept exactly as received; no case
 * normalization is applied. Headers carry the first value per name, cookies
 * the last value per name.
 *
 * <p>
 * Immutable. All maps are unmodifiable copies, and {@link #body()} returns
 * a copy of the captured bytes.
 */
public final class RequestSnapshot {

    private static final byte[] NO_BODY = new byte[0];

    private final String remoteAddress;
    private final String host;
    private final Map<String, String> headers;
    private final Map<String, String> cookies;
    private final Map<String, List<String>> query;
    private final byte[] body;

    private RequestSnapshot(Builder builder) {
        this.remoteAddress = builder.remoteAddress;
        this.host = builder.host;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
        Map<String, List<String>> queryCopy = new LinkedHashMap<>();
        builder.query.forEach((name, values) -> queryCopy.put(name, List.copyOf(values)));
        this.query = Collections.unmodifiableMap(queryCopy);
        this.body = builder.body != null ? builder.body.clone() : NO_BODY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Caller IP address, without the port. */
    public String remoteAddress() {
        return remoteAddress;
    }

    /** Value of the {@code Host} header, or {@code null} if absent. */
    public String host() {
        return host;
    }

    /** First value per header name, in the order the names were received. */
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * First value of a header, looked up by exact name.
     *
     * @return the value, or {@code null} if absent
     */
    public String header(String name) {
        return headers.get(name);
    }

    /**
     * First value of a header, looked up ignoring case. Used for protocol
     * headers ({@code Content-Type}, {@code If-None-Match}) whose casing the
     * client controls.
     *
     * @return the value, or {@code null} if absent
     */
    public String headerIgnoreCase(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /** Cookie name to value; the last duplicate wins. */
    public Map<String, String> cookies() {
        return cookies;
    }

    /** Query parameter name to all of its values, in first-seen key order. */
    public Map<String, List<String>> query() {
        return query;
    }

    /**
     * First value of a query parameter.
     *
     * @return the value, or {@code null} if the parameter is absent
     */
    public String queryParam(String name) {
        List<String> values = query.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /** Raw request body (never {@code null}). */
    public byte[] body() {
        return body.clone();
    }

    /** Request body decoded as UTF-8 text. */
    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "RequestSnapshot[origin=" + remoteAddress + ", headers=" + headers.keySet() + ", body="
                + body.length + " bytes]";
    }

    /** Builder for {@link RequestSnapshot}; every field is optional. */
    public static final class Builder {
        private String remoteAddress = "";
        private String host;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private final Map<String, List<String>> query = new LinkedHashMap<>();
        private byte[] body;

        Builder() {}

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress != null ? remoteAddress : "";
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Records a header; only the first value seen for a name is kept. */
        public Builder header(String name, String value) {
            headers.putIfAbsent(name, value);
            return this;
        }

        /** Records a cookie; a later value for the same name replaces the earlier one. */
        public Builder cookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder query(Map<String, List<String>> query) {
            this.query.clear();
            this.query.putAll(query);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public RequestSnapshot build() {
            return new RequestSnapshot(this);
        }
    }
}
