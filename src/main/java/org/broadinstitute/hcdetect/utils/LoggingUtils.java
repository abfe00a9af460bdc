package org.broadinstitute.hcdetect.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Logging utilities.
 *
 * The library speaks its own {@link LogLevel} verbosity and maps it onto log4j levels, of which it supports a subset.
 */
public class LoggingUtils {

    /**
     * Verbosity levels understood by {@link #setLoggingLevel(LogLevel)}.
     */
    public enum LogLevel {
        ERROR, WARNING, INFO, DEBUG
    }

    private static final BiMap<LogLevel, Level> LOG4J_LEVELS = EnumHashBiMap.create(LogLevel.class);
    static {
        LOG4J_LEVELS.put(LogLevel.ERROR, Level.ERROR);
        LOG4J_LEVELS.put(LogLevel.WARNING, Level.WARN);
        LOG4J_LEVELS.put(LogLevel.INFO, Level.INFO);
        LOG4J_LEVELS.put(LogLevel.DEBUG, Level.DEBUG);
    }

    // Package-private for unit test access
    static LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return LOG4J_LEVELS.inverse().get(log4jLevel);
    }

    /**
     * @return the log4j {@link Level} of {@code level}.
     */
    public static Level levelToLog4jLevel(final LogLevel level) {
        return LOG4J_LEVELS.get(level);
    }

    /**
     * Sets the level of the log4j configuration that governs this library's loggers.
     */
    public static void setLoggingLevel(final LogLevel verbosity) {
        Utils.nonNull(verbosity, "the verbosity level cannot be null");
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final LoggerConfig loggerConfig = loggerContext.getConfiguration().getLoggerConfig(LoggingUtils.class.getName());
        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
