package org.battlebots.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

/**
 * Applies the {@code logging} section of the configuration to Logback.
 * <pre>
 * logging {
 *   level = INFO
 *   loggers { "org.battlebots.ctl" = DEBUG }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG, as {@link Level#toLevel(String)} does.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and every per-logger override found in {@code config}.
     * Does nothing if SLF4J is not bound to Logback.
     *
     * @param config the application configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString("logging.level")));
        }

        if (config.hasPath("logging.loggers")) {
            // Quoted ("org.battlebots.ctl") and nested (org.battlebots.ctl) keys name the same logger
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.loggers").entrySet()) {
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level));
            }
        }
    }
}
