package org.littlemanplus.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the log levels from the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.littlemanplus.runtime.VirtualMachine" = "DEBUG"
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

    private LoggingConfigurator() {}

    /**
     * Configures the logging system. Calling it again has no effect.
     *
     * @param config The application configuration containing logging settings.
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

        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LOGGER.debug("Logging backend is not Logback, skipping level configuration.");
            return;
        }
        apply(config.getConfig(LOGGING_CONFIG_PATH), context);
    }

    /**
     * Applies the levels of a {@code logging} section to the given context.
     *
     * @param loggingConfig The {@code logging} section.
     * @param context The Logback context.
     */
    static void apply(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            final Config levels = loggingConfig.getConfig(LEVELS_KEY);
            // Logger names contain dots, so iterate the root object instead of the flattened paths.
            levels.root().keySet().forEach(loggerName -> {
                final String levelStr = levels.root().get(loggerName).unwrapped().toString();
                final Level level = Level.toLevel(levelStr, Level.INFO);
                context.getLogger(loggerName).setLevel(level);
                LOGGER.debug("Configured log level for '{}': {}", loggerName, level);
            });
        }
    }
}
