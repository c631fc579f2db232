package io.maia.common.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sets up Logback from the HOCON {@code logging} section once the command line configuration is known.
 * Everything goes to stderr; stdout is reserved for command output.
 *
 * <pre>
 * logging {
 *     level = "WARN"
 *     pattern = "%-5level %msg%n"
 *     loggers {
 *         "io.maia.client" = "DEBUG"
 *     }
 * }
 * </pre>
 */
public final class LogbackConfigurator {

    public static final String DEBUG_ENV = "MAIA_DEBUG";

    private static final String APPENDER_NAME = "STDERR";
    private static final String DEFAULT_PATTERN = "%-5level %msg%n";
    private static final Level DEFAULT_LEVEL = Level.WARN;
    private static final Map<String, Level> QUIET_LOGGERS = Map.of("jdk.httpclient", Level.WARN);

    private LogbackConfigurator() {
    }

    /**
     * Replaces the boot configuration. With {@code debug} set, the root logger is forced to DEBUG and
     * the per-logger levels are ignored.
     */
    public static void configure(Config config, boolean debug) {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        var pattern = config.hasPath("logging.pattern") ? config.getString("logging.pattern") : DEFAULT_PATTERN;
        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(stderrAppender(context, pattern));
        root.setLevel(debug ? Level.DEBUG : rootLevel(config));

        if (!debug) {
            loggerLevels(config).forEach((name, level) -> context.getLogger(name).setLevel(level));
        }
        QUIET_LOGGERS.forEach((name, level) -> {
            var logger = context.getLogger(name);
            if (logger.getLevel() == null) {
                logger.setLevel(level);
            }
        });
    }

    public static boolean debugRequested(String envValue) {
        return "1".equals(envValue);
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(LoggerContext context, String pattern) {
        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();

        var appender = new ConsoleAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    private static Level rootLevel(Config config) {
        return config.hasPath("logging.level")
                ? Level.toLevel(config.getString("logging.level"), DEFAULT_LEVEL)
                : DEFAULT_LEVEL;
    }

    /**
     * Logger names contain dots, so they are read as the quoted keys of the {@code loggers} object.
     */
    private static Map<String, Level> loggerLevels(Config config) {
        Map<String, Level> levels = new LinkedHashMap<>();
        if (config.hasPath("logging.loggers")) {
            config.getObject("logging.loggers").forEach((name, value) ->
                    levels.put(name, Level.toLevel(String.valueOf(value.unwrapped()), DEFAULT_LEVEL)));
        }
        return levels;
    }
}
