package org.pragmatica.ddmm.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.LoggerFactory;

/**
 * Applies log levels from configuration to Logback.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.pragmatica.ddmm.build" = "DEBUG"
 *   }
 * }
 * </pre>
 */
final class LoggingConfigurator {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    private static final String BASE_LOGGER = "org.pragmatica.ddmm";

    private LoggingConfigurator() {}

    /**
     * @param verbose force DEBUG for this tool's loggers regardless of configuration
     */
    static void configure(Config config, boolean verbose) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.debug("Logback is not the active SLF4J binding, leaving log levels untouched");
            return;
        }
        if (config.hasPath(LOGGING_PATH)) {
            var logging = config.getConfig(LOGGING_PATH);
            if (logging.hasPath(DEFAULT_LEVEL_KEY)) {
                context.getLogger(Logger.ROOT_LOGGER_NAME)
                       .setLevel(Level.toLevel(logging.getString(DEFAULT_LEVEL_KEY), Level.WARN));
            }
            if (logging.hasPath(LEVELS_KEY)) {
                var levels = logging.getObject(LEVELS_KEY);
                for (var name : levels.keySet()) {
                    var level = String.valueOf(levels.get(name)
                                                     .unwrapped());
                    context.getLogger(name)
                           .setLevel(Level.toLevel(level, Level.INFO));
                }
            }
        }
        if (verbose) {
            context.getLogger(BASE_LOGGER)
                   .setLevel(Level.DEBUG);
        }
    }
}
