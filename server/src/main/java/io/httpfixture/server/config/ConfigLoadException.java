package io.httpfixture.server.config;

/**
 * Startup failure while resolving {@link ServerConfig}. The message names the
 * offending YAML key, environment variable or CLI option so {@code main} can
 * print it as is; {@link #source()} carries that name when one is known.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ConfigLoadException(String message) {
        this(null, message, null);
    }

    public ConfigLoadException(String message, Throwable cause) {
        this(null, message, cause);
    }

    private ConfigLoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /** A value under {@code source} that is not an integer. */
    static ConfigLoadException notAnInteger(String source, String value, Throwable cause) {
        return new ConfigLoadException(source, source + " must be an integer, got '" + value + "'", cause);
    }

    /** YAML key or environment variable the failure is about, or {@code null}. */
    public String source() {
        return source;
    }
}
