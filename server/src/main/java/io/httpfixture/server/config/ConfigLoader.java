package io.httpfixture.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports three invocation patterns:
 * <ul>
 * <li>{@code --config /path/to/config.yaml}: loads from the given path, which
 * must exist</li>
 * <li>No {@code --config}: loads {@code http-fixture.yaml} from the current
 * directory if present</li>
 * <li>Neither: documented defaults from {@link ServerConfig.Builder}</li>
 * </ul>
 * {@code --listen host:port} is applied last and wins over YAML and
 * environment.
 *
 * <p>
 * Environment variable overlay: every key can be overridden by an env var,
 * which takes precedence over the YAML value. An env var is considered "set"
 * if and only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file looked up in the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "http-fixture.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves the configuration for a command line, using {@link System#getenv}.
     *
     * @param args command-line arguments
     * @return a validated {@link ServerConfig}
     * @throws ConfigLoadException if the configuration cannot be loaded or is invalid
     */
    public static ServerConfig fromArgs(String[] args) {
        return fromArgs(args, System::getenv, Path.of(DEFAULT_CONFIG_FILE));
    }

    /**
     * Resolves the configuration for a command line.
     *
     * @param args          command-line arguments
     * @param envLookup     environment variable lookup function
     * @param defaultConfig file used when {@code --config} is absent; skipped if it does not exist
     * @return a validated {@link ServerConfig}
     */
    public static ServerConfig fromArgs(String[] args, Function<String, String> envLookup, Path defaultConfig) {
        Optional<Path> explicit = optionValue(args, "--config").map(Path::of);
        ServerConfig.Builder builder;
        if (explicit.isPresent()) {
            builder = readYaml(explicit.get());
        } else if (Files.exists(defaultConfig)) {
            builder = readYaml(defaultConfig);
        } else {
            builder = ServerConfig.builder();
        }

        applyEnvOverrides(builder, envLookup);

        optionValue(args, "--listen").map(ListenAddress::parse).ifPresent(listen -> {
            builder.host(listen.host());
            builder.port(listen.port());
        });
        return builder.build();
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying env
     * overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying env
     * overrides from the supplied lookup function. Returning {@code null}
     * from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid
     *                             YAML, or holds an out-of-range value
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        ServerConfig.Builder builder = readYaml(configPath);
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Returns the value following {@code option} in {@code args}.
     *
     * @throws IllegalArgumentException if the option is the last argument
     */
    static Optional<String> optionValue(String[] args, String option) {
        for (int i = 0; i < args.length; i++) {
            if (option.equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(option + " requires a value");
                }
                return Optional.of(args[i + 1]);
            }
        }
        return Optional.empty();
    }

    private static ServerConfig.Builder readYaml(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToBuilder(root != null ? root : YAML_MAPPER.createObjectNode());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Maps a parsed YAML tree onto a builder; absent keys keep their defaults. */
    private static ServerConfig.Builder mapToBuilder(JsonNode root) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // Server section
        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(requireInt(server, "port", "server.port"));

        // Tunables
        JsonNode delay = root.path("delay");
        if (delay.has("max-ms")) builder.maxDelayMs(requireLong(delay, "max-ms", "delay.max-ms"));
        JsonNode stream = root.path("stream");
        if (stream.has("interval-ms"))
            builder.streamIntervalMs(requireLong(stream, "interval-ms", "stream.interval-ms"));
        JsonNode bytes = root.path("bytes");
        if (bytes.has("chunk-size")) builder.chunkSize(requireInt(bytes, "chunk-size", "bytes.chunk-size"));

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        if (logging.has("request-log"))
            builder.requestLogEnabled(logging.get("request-log").asBoolean());

        return builder;
    }

    /** Applies environment variable overrides to the builder. */
    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "FIXTURE_HOST", builder::host);
        envInt(envLookup, "FIXTURE_PORT", builder::port);
        envLong(envLookup, "FIXTURE_DELAY_MAX_MS", builder::maxDelayMs);
        envLong(envLookup, "FIXTURE_STREAM_INTERVAL_MS", builder::streamIntervalMs);
        envInt(envLookup, "FIXTURE_BYTES_CHUNK_SIZE", builder::chunkSize);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envBool(envLookup, "LOG_REQUESTS", builder::requestLogEnabled);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw ConfigLoadException.notAnInteger(envVar, value, e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw ConfigLoadException.notAnInteger(envVar, value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int requireInt(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw ConfigLoadException.notAnInteger(key, value.asText(), null);
        }
        return value.asInt();
    }

    private static long requireLong(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw ConfigLoadException.notAnInteger(key, value.asText(), null);
        }
        return value.asLong();
    }
}
