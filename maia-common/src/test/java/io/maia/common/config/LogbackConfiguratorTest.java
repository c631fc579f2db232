package io.maia.common.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void tearDown() {
        LogbackConfigurator.configure(ConfigFactory.empty(), false);
    }

    @Test
    @DisplayName("Should apply root and per-logger levels with dotted names")
    void levels() {
        var config = ConfigFactory.parseString("""
                logging {
                    level = "ERROR"
                    loggers {
                        "io.maia.client.keystone" = "DEBUG"
                    }
                }
                """);

        LogbackConfigurator.configure(config, false);

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("io.maia.client.keystone").getLevel());
        assertEquals(Level.WARN, context.getLogger("jdk.httpclient").getLevel());
    }

    @Test
    @DisplayName("Should default the root level to WARN and log to stderr")
    void defaults() {
        LogbackConfigurator.configure(ConfigFactory.empty(), false);

        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertEquals(Level.WARN, root.getLevel());
        var appender = (ConsoleAppender<?>) root.getAppender("STDERR");
        assertNotNull(appender);
        assertEquals("System.err", appender.getTarget());
    }

    @Test
    @DisplayName("Should force DEBUG when MAIA_DEBUG=1")
    void debug() {
        LogbackConfigurator.configure(ConfigFactory.parseString("logging.level = ERROR"),
                LogbackConfigurator.debugRequested("1"));

        assertEquals(Level.DEBUG, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertFalse(LogbackConfigurator.debugRequested("true"));
        assertFalse(LogbackConfigurator.debugRequested(null));
    }
}
