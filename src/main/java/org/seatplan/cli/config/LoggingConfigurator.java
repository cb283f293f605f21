package org.seatplan.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Applies the {@code logging} block of the application configuration to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"            # any other value selects the timestamped layout
 *   default-level = "INFO"
 *   levels { "org.seatplan.runtime.anneal" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** Logback context property naming the console appender in use. */
    public static final String FORMAT_PROPERTY = "seatplan.logging.format";

    private static final Set<String> CONFIGURED_LOGGERS = new LinkedHashSet<>();

    private LoggingConfigurator() {}

    /**
     * Maps a configured format name to the console appender of {@code logback.xml}.
     */
    public static String appenderFor(String format) {
        return "PLAIN".equalsIgnoreCase(format) ? "CONSOLE_PLAIN" : "CONSOLE";
    }

    public static synchronized void configure(Config config) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (config.hasPath("logging.format")) {
            context.putProperty(FORMAT_PROPERTY, appenderFor(config.getString("logging.format")));
        }

        if (config.hasPath("logging.default-level")) {
            final Level level = parseLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                final String loggerName = stripQuotes(entry.getKey());
                final Level level = parseLevel(String.valueOf(entry.getValue().unwrapped()), null);
                if (level == null) {
                    LoggerFactory.getLogger(LoggingConfigurator.class)
                            .warn("Ignoring unknown log level '{}' for logger '{}'", entry.getValue().unwrapped(), loggerName);
                    continue;
                }
                context.getLogger(loggerName).setLevel(level);
                CONFIGURED_LOGGERS.add(loggerName);
            }
        }
    }

    /**
     * Removes all levels applied by {@link #configure(Config)} and restores the root logger to INFO.
     */
    public static synchronized void reset() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        for (String loggerName : CONFIGURED_LOGGERS) {
            context.getLogger(loggerName).setLevel(null);
        }
        CONFIGURED_LOGGERS.clear();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
        context.putProperty(FORMAT_PROPERTY, appenderFor("PLAIN"));
    }

    private static Level parseLevel(String value, Level fallback) {
        if (value == null) {
            return fallback;
        }
        final Level level = Level.toLevel(value.trim(), null);
        return level != null ? level : fallback;
    }

    private static String stripQuotes(String key) {
        if (key.length() >= 2 && key.startsWith("\"") && key.endsWith("\"")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
