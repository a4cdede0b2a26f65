package org.lrcalc.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels from the {@code logging} block of the configuration to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.lrcalc.frontend.lexer" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the log levels. Calling it again has no effect until {@link #reset()}.
     *
     * @param config The configuration containing the {@code logging} block.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
            for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
                final String loggerName = entry.getKey();
                final Level level = Level.toLevel(entry.getValue().unwrapped().toString(), Level.DEBUG);
                context.getLogger(loggerName).setLevel(level);
                LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
            }
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Meant for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }

    /**
     * @return {@code true} once {@link #configure(Config)} has run since the last reset.
     */
    public static synchronized boolean isConfigured() {
        return loggingConfigured;
    }
}
