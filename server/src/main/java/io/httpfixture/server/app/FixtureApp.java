package io.httpfixture.server.app;

import io.httpfixture.core.config.FixtureSettings;
import io.httpfixture.server.config.ConfigLoader;
import io.httpfixture.server.config.ServerConfig;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the fixture server.
 *
 * <ol>
 * <li>Resolve configuration (YAML, env overlay, {@code --listen})</li>
 * <li>Reconfigure Logback from {@code logging.*}</li>
 * <li>Create Javalin with compression off, register routes and exception mappers</li>
 * <li>Bind to the configured host and port</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.httpfixture.server.FixtureMain} so tests can
 * start and stop servers without going through {@code main()}.
 */
public final class FixtureApp {

    private static final Logger LOG = LoggerFactory.getLogger(FixtureApp.class);
    private static final Logger REQUEST_LOG = LoggerFactory.getLogger(LogbackConfigurator.REQUEST_LOGGER);

    private final Javalin app;
    private final ServerConfig config;

    private FixtureApp(Javalin app, ServerConfig config) {
        this.app = app;
        this.config = config;
    }

    /**
     * Resolves configuration from the command line and environment, applies
     * the logging settings and starts the server.
     *
     * @param args command-line arguments ({@code --config}, {@code --listen})
     * @return a running application
     */
    public static FixtureApp start(String[] args) {
        ServerConfig config = ConfigLoader.fromArgs(args);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel(), config.requestLogEnabled());
        return start(config);
    }

    /**
     * Starts a server for an already resolved configuration. Logging setup is
     * left untouched.
     *
     * @param config validated configuration; port {@code 0} binds an ephemeral port
     * @return a running application
     */
    public static FixtureApp start(ServerConfig config) {
        long startTime = System.nanoTime();
        FixtureSettings settings = config.settings();

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            // encoding endpoints set Content-Encoding themselves
            javalinConfig.http.disableCompression();
            if (config.requestLogEnabled()) {
                javalinConfig.requestLogger.http((ctx, ms) -> REQUEST_LOG.info(
                        "{} {} {} {}ms", ctx.method().name(), ctx.path(), ctx.statusCode(), Math.round(ms)));
            }
        });

        int paths = FixtureRoutes.register(app, settings);
        ExceptionMappers.register(app);

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "http-fixture started: host={}, port={}, routes={}, maxDelay={}, streamInterval={}, chunkSize={}, startupMs={}",
                config.host(),
                app.port(),
                paths,
                settings.maxDelay(),
                settings.streamInterval(),
                settings.chunkSize(),
                elapsedMs);
        return new FixtureApp(app, config);
    }

    /** Port the server is bound to. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public ServerConfig config() {
        return config;
    }

    /** Stops the Javalin server. */
    public void stop() {
        app.stop();
        LOG.info("http-fixture stopped");
    }
}
