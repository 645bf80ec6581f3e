package io.httpfixture.server;

import io.httpfixture.server.app.FixtureApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Starts {@link FixtureApp} and stops it again on JVM
 * shutdown; any startup failure is logged and exits with status 1.
 */
public final class FixtureMain {

    private static final Logger LOG = LoggerFactory.getLogger(FixtureMain.class);

    private FixtureMain() {
        // utility class
    }

    /**
     * @param args {@code --config path/to/http-fixture.yaml}, {@code --listen host:port}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            FixtureApp app = FixtureApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "http-fixture-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
