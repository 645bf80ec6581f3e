package io.httpfixture.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Configuration validation")
class ConfigValidationTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void malformedYamlFails() throws Exception {
        Path file = write("this is: not: valid: yaml: {{{}}}");

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Failed to parse YAML");
    }

    @Test
    void portOutOfRangeFails() throws Exception {
        Path file = write("""
                server:
                  port: 70000
                """);

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.port");
    }

    @Test
    void nonIntegerPortFails() throws Exception {
        Path file = write("""
                server:
                  port: "eighty"
                """);

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.port must be an integer")
                .isInstanceOfSatisfying(ConfigLoadException.class, e -> assertThat(e.source()).isEqualTo("server.port"));
    }

    @Test
    void negativeDelayFails() throws Exception {
        Path file = write("""
                delay:
                  max-ms: -1
                """);

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("delay.max-ms");
    }

    @Test
    void negativeStreamIntervalFails() throws Exception {
        Path file = write("""
                stream:
                  interval-ms: -5
                """);

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("stream.interval-ms");
    }

    @Test
    void zeroChunkSizeFails() throws Exception {
        Path file = write("""
                bytes:
                  chunk-size: 0
                """);

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("bytes.chunk-size");
    }

    @Test
    void unknownLogFormatFails() throws Exception {
        Path file = write("""
                logging:
                  format: xml
                """);

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("logging.format");
    }

    @Test
    void blankHostFails() {
        assertThatThrownBy(() -> ServerConfig.builder().host(" ").build())
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.host");
    }
}
