package io.edgesim.standalone.server;

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
 * Programmatic Logback setup from {@code logging.format} and
 * {@code logging.level}.
 *
 * <p>
 * {@code json} uses Logback's {@link JsonEncoder}; anything else uses a
 * human-readable pattern.
 *
 * <p>
 * The configured level applies to the simulator's own loggers
 * ({@code io.edgesim}), where DEBUG shows every lifecycle transition and
 * cache decision. Third-party loggers never go below INFO, and Jetty stays at
 * WARN, so a DEBUG run is not flooded by server and client internals.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final String APP_LOGGER = "io.edgesim";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root logger's appenders with a single console appender.
     *
     * @param format {@code json} or {@code text}
     * @param level  level name for {@code io.edgesim}; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level appLevel = Level.toLevel(level, Level.INFO);
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(appLevel.isGreaterOrEqual(Level.INFO) ? appLevel : Level.INFO);
        rootLogger.detachAndStopAllAppenders();
        context.getLogger(APP_LOGGER).setLevel(appLevel);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDOUT");
        appender.setEncoder(encoder(context, format));
        appender.start();
        rootLogger.addAppender(appender);

        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
