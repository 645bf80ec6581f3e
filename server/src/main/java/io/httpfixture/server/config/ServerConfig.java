package io.httpfixture.server.config;

import io.httpfixture.core.config.FixtureSettings;
import java.time.Duration;

/**
 * Root configuration of the fixture server.
 *
 * <p>
 * Every field has a default; use {@link #builder()} to construct instances.
 * {@link Builder#build()} rejects out-of-range values with a
 * {@link ConfigLoadException}.
 *
 * @param host              bind address
 * @param port              listen port; {@code 0} picks an ephemeral port
 * @param maxDelayMs        upper bound for {@code /delay/{n}}, in milliseconds
 * @param streamIntervalMs  pause before each {@code /stream/{n}} line, in milliseconds
 * @param chunkSize         buffer length for {@code /bytes/{n}}
 * @param loggingFormat     {@code text} or {@code json}
 * @param loggingLevel      root log level (TRACE, DEBUG, INFO, WARN, ERROR)
 * @param requestLogEnabled whether every request is logged at INFO
 */
public record ServerConfig(
        String host,
        int port,
        long maxDelayMs,
        long streamIntervalMs,
        int chunkSize,
        String loggingFormat,
        String loggingLevel,
        boolean requestLogEnabled) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Endpoint tunables derived from this configuration. */
    public FixtureSettings settings() {
        return new FixtureSettings(
                Duration.ofMillis(maxDelayMs), Duration.ofMillis(streamIntervalMs), chunkSize);
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private long maxDelayMs = FixtureSettings.DEFAULT_MAX_DELAY.toMillis();
        private long streamIntervalMs = FixtureSettings.DEFAULT_STREAM_INTERVAL.toMillis();
        private int chunkSize = FixtureSettings.DEFAULT_CHUNK_SIZE;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private boolean requestLogEnabled = true;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder streamIntervalMs(long streamIntervalMs) {
            this.streamIntervalMs = streamIntervalMs;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder requestLogEnabled(boolean requestLogEnabled) {
            this.requestLogEnabled = requestLogEnabled;
            return this;
        }

        /**
         * Builds the {@link ServerConfig}.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public ServerConfig build() {
            if (host == null || host.isBlank()) {
                throw new ConfigLoadException("server.host must not be empty");
            }
            if (port < 0 || port > 65535) {
                throw new ConfigLoadException("server.port must be between 0 and 65535, got " + port);
            }
            if (maxDelayMs < 0) {
                throw new ConfigLoadException("delay.max-ms must not be negative, got " + maxDelayMs);
            }
            if (streamIntervalMs < 0) {
                throw new ConfigLoadException("stream.interval-ms must not be negative, got " + streamIntervalMs);
            }
            if (chunkSize <= 0) {
                throw new ConfigLoadException("bytes.chunk-size must be positive, got " + chunkSize);
            }
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'text' or 'json', got '" + loggingFormat + "'");
            }
            return new ServerConfig(
                    host,
                    port,
                    maxDelayMs,
                    streamIntervalMs,
                    chunkSize,
                    loggingFormat,
                    loggingLevel,
                    requestLogEnabled);
        }
    }
}
