package io.httpfixture.server.config;

/**
 * A {@code host:port} listen address as given on the command line.
 *
 * @param host bind address; {@code 0.0.0.0} when the text starts with {@code :}
 * @param port listen port
 */
public record ListenAddress(String host, int port) {

    private static final String ANY_HOST = "0.0.0.0";

    /**
     * Parses {@code host:port}, {@code :port} or {@code [v6-address]:port}.
     *
     * @throws ConfigLoadException if the text has no port or the port is not a number in range
     */
    public static ListenAddress parse(String text) {
        if (text == null) {
            throw new ConfigLoadException("listen address must not be null");
        }
        int colon = text.lastIndexOf(':');
        if (colon < 0) {
            throw new ConfigLoadException("listen address must be <host>:<port>, got '" + text + "'");
        }
        String host = text.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(text.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("listen address has an invalid port: '" + text + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new ConfigLoadException("listen port must be between 0 and 65535, got " + port);
        }
        return new ListenAddress(host.isEmpty() ? ANY_HOST : host, port);
    }
}
