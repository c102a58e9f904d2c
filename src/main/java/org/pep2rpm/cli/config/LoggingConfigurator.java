package org.pep2rpm.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import org.slf4j.LoggerFactory;

/**
 * Applies per-logger levels from {@code pep2rpm.logging.levels} to Logback.
 * <pre>
 *   pep2rpm.logging.levels {
 *     "org.pep2rpm" = INFO
 *     "org.pep2rpm.translator.requirement" = DEBUG
 *   }
 * </pre>
 */
public final class LoggingConfigurator {

    static final String LEVELS_PATH = "pep2rpm.logging.levels";

    private LoggingConfigurator() {
    }

    /**
     * Sets the configured levels. Does nothing when SLF4J is not bound to Logback.
     * @param config The resolved configuration.
     */
    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Config levels = config.getConfig(LEVELS_PATH);
        for (String loggerName : levels.root().keySet()) {
            String level = levels.getString(ConfigUtil.joinPath(loggerName));
            context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}
