package org.unbundle.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the {@code unbundle.logging} block to Logback.
 *
 * <pre>
 * unbundle.logging {
 *   default-level = "INFO"
 *   levels { "org.unbundle.splitter" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final String DEFAULT_LEVEL = SplitterConfig.ROOT + ".logging.default-level";
    private static final String LEVELS = SplitterConfig.ROOT + ".logging.levels";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath(DEFAULT_LEVEL)) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString(DEFAULT_LEVEL), Level.INFO));
        }
        if (config.hasPath(LEVELS)) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject(LEVELS).entrySet()) {
                Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO);
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
    }
}
