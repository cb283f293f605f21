package org.seatplan.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("CONSOLE_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withOtherFormat_shouldSelectDetailedAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"DETAILED\""));

        assertEquals("CONSOLE", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_shouldApplyDefaultAndPerLoggerLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.seatplan.runtime.anneal" = "DEBUG"
                "org.seatplan.problem" = "TRACE"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context().getLogger("org.seatplan.runtime.anneal").getLevel());
        assertEquals(Level.TRACE, context().getLogger("org.seatplan.problem").getLevel());
    }

    @Test
    void reset_shouldClearConfiguredLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"org.seatplan.cli.commands\" = \"DEBUG\" }"));

        LoggingConfigurator.reset();

        assertNull(context().getLogger("org.seatplan.cli.commands").getLevel());
        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_shouldIgnoreUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"org.seatplan.cli.rendering\" = \"LOUD\" }"));

        assertNull(context().getLogger("org.seatplan.cli.rendering").getLevel());
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}
