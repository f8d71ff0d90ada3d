package com.tyron.nanodi.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup for the container loggers.
 *
 * Controls java.util.logging output of {@code com.tyron.nanodi.*} via system property:
 * - nanodi.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 */
public final class TestLogging {

    public static final String LOGGER_NAMESPACE = "com.tyron.nanodi";
    public static final String LOG_LEVEL_KEY = "nanodi.test.logLevel";

    // Strong reference, otherwise the configured logger may be collected and lose its settings.
    private static final Logger NAMESPACE_LOGGER = Logger.getLogger(LOGGER_NAMESPACE);

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LOG_LEVEL_KEY, "INFO"));

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new ResolutionLogFormatter());

        NAMESPACE_LOGGER.setUseParentHandlers(false);
        NAMESPACE_LOGGER.setLevel(level);
        NAMESPACE_LOGGER.addHandler(console);

        NAMESPACE_LOGGER.log(Level.INFO, "testLogging configured level=" + level.getName());
    }

    /**
     * Starts collecting records of the container loggers at {@code level} or above.
     * Close the returned capture to detach it.
     */
    public static LogCapture capture(Level level) {
        return LogCapture.attach(NAMESPACE_LOGGER, level);
    }

    static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.INFO;
        }
    }

    /**
     * {@code 12:00:01.123 FINE    DefaultServiceScope - Creating 'a' (SINGLETON) in scope (unnamed)}
     */
    private static final class ResolutionLogFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ');
            out.append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ');
            out.append(simpleName(record.getLoggerName())).append(" - ");
            out.append(formatMessage(record)).append('\n');

            if (record.getThrown() != null) {
                StringWriter sw = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }
}
