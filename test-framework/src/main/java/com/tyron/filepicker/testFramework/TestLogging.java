package com.tyron.filepicker.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system properties:
 * - filepicker.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE (root level)
 * - filepicker.test.logLevel.engine=... (only loggers under com.tyron.filepicker)
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "filepicker.test.logLevel";
    public static final String ENGINE_LEVEL_PROPERTY = LEVEL_PROPERTY + ".engine";

    private static final String ENGINE_LOGGER = "com.tyron.filepicker";

    // Strong reference so the configured level is not lost when the logger is collected.
    private static Logger engineLogger;
    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level rootLevel = parseLevel(System.getProperty(LEVEL_PROPERTY), Level.INFO);
        Level engineLevel = parseLevel(System.getProperty(ENGINE_LEVEL_PROPERTY), rootLevel);
        Level handlerLevel = engineLevel.intValue() < rootLevel.intValue() ? engineLevel : rootLevel;

        Formatter formatter = new CompactFormatter();
        Logger root = Logger.getLogger("");
        root.setLevel(rootLevel);
        for (Handler h : root.getHandlers()) {
            h.setLevel(handlerLevel);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(formatter);
            }
        }

        engineLogger = Logger.getLogger(ENGINE_LOGGER);
        engineLogger.setLevel(engineLevel);

        root.log(Level.INFO, "test logging root=" + rootLevel.getName() + " engine=" + engineLevel.getName());
    }

    static Level parseLevel(String raw, Level fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static final class CompactFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis())))
                    .append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName()))
                    .append(" [").append(Thread.currentThread().getName()).append("] ")
                    .append(simpleName(record.getLoggerName()))
                    .append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            String simple = loggerName.substring(loggerName.lastIndexOf('.') + 1);
            int dollar = simple.indexOf('$');
            return dollar >= 0 ? simple.substring(0, dollar) : simple;
        }
    }
}
