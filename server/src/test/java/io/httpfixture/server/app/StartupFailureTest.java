package io.httpfixture.server.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.httpfixture.server.config.ConfigLoadException;
import io.httpfixture.server.config.ServerConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Startup and shutdown")
class StartupFailureTest {

    private FixtureApp running;

    @TempDir
    Path tempDir;

    @AfterEach
    void cleanup() {
        if (running != null) {
            running.stop();
        }
    }

    @Test
    void missingConfigFileFails() {
        assertThatThrownBy(() -> FixtureApp.start(new String[] {"--config", "/nonexistent/http-fixture.yaml"}))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void invalidConfigFails() throws Exception {
        Path configFile = tempDir.resolve("bad.yaml");
        Files.writeString(configFile, """
                bytes:
                  chunk-size: -1
                """);

        assertThatThrownBy(() -> FixtureApp.start(new String[] {"--config", configFile.toString()}))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("bytes.chunk-size");
    }

    @Test
    @DisplayName("binding a port that is already in use fails")
    void portInUseFails() {
        running = FixtureApp.start(ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .requestLogEnabled(false)
                .build());
        ServerConfig clash = ServerConfig.builder()
                .host("127.0.0.1")
                .port(running.port())
                .requestLogEnabled(false)
                .build();

        assertThatThrownBy(() -> FixtureApp.start(clash)).isInstanceOf(RuntimeException.class);
    }

    @Test
    void startsOnEphemeralPortAndExposesConfig() {
        ServerConfig config = ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .requestLogEnabled(true)
                .build();

        running = FixtureApp.start(config);

        assertThat(running.port()).isPositive();
        assertThat(running.config()).isSameAs(config);
        assertThat(running.javalin()).isNotNull();
    }
}
