package io.httpfixture.server.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the root console appender from {@code logging.format} and
 * {@code logging.level} once the configuration is known.
 *
 * <p>
 * {@code json} selects Logback's {@link JsonEncoder}; anything else the
 * {@link #TEXT_PATTERN}. Access lines go to {@link #REQUEST_LOGGER}, which
 * is pinned to INFO while {@code logging.request-log} is on and switched off
 * otherwise, independent of the root level.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "CONSOLE";

    /** Logger that receives one line per handled request. */
    public static final String REQUEST_LOGGER = "io.httpfixture.request";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format {@code json} or {@code text}
     * @param level      root level name; unknown names fall back to INFO
     * @param requestLog whether access lines are written
     */
    public static void configure(String format, String level, boolean requestLog) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(context, format));
        appender.start();
        root.addAppender(appender);

        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
        context.getLogger("io.javalin").setLevel(Level.INFO);
        context.getLogger(REQUEST_LOGGER).setLevel(requestLog ? Level.INFO : Level.OFF);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
