package org.gamevibe.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"  # "PLAIN" or "JSON"
 *   default-level = "WARN"
 *   levels {
 *     "org.gamevibe.compiler.Compiler" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    /** The system and context property read by {@code logback.xml} to pick the console appender. */
    public static final String FORMAT_PROPERTY = "gdl.logging.format";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * Only the first call has an effect until {@link #reset()} is called.
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

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
        final boolean changed = !appender.equals(System.getProperty(FORMAT_PROPERTY, "STDOUT_PLAIN"));
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);
        if (changed) {
            reloadLogback(context);
        }
        LOGGER.debug("Configured logging format: {}", appender);
    }

    /**
     * Re-reads {@code logback.xml} so that the appender selection takes effect.
     */
    private static void reloadLogback(final LoggerContext context) {
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.warn("Failed to reconfigure Logback: {}", e.getMessage());
        }
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(loggerName).setLevel(Level.toLevel(levelName, Level.INFO));
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configuration state so that the next {@link #configure} call applies again.
     * Intended for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
