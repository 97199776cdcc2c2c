package ember.utils;

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
 * Static logging facade over {@code java.util.logging}. One line per record:
 * {@code 12:00:01.123 [LEVEL] [thread] message}.
 */
public class Log {
    private static final Logger logger = Logger.getLogger("Ember");
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    static {
        logger.setUseParentHandlers(false);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new Formatter() {
            @Override
            public String format(LogRecord record) {
                StringBuilder sb = new StringBuilder(96)
                        .append(TIMESTAMP.format(Instant.ofEpochMilli(record.getMillis())))
                        .append(" [").append(levelName(record.getLevel())).append("] [")
                        .append(Thread.currentThread().getName()).append("] ")
                        .append(record.getMessage())
                        .append(System.lineSeparator());
                if (record.getThrown() != null) {
                    sb.append("    caused by: ").append(record.getThrown()).append(System.lineSeparator());
                }
                return sb.toString();
            }
        });
        logger.addHandler(handler);
        logger.setLevel(Boolean.getBoolean("ember.debug") ? Level.FINE : Level.INFO);
    }

    private static String levelName(Level level) {
        if (level == Level.SEVERE) return "ERROR";
        if (level == Level.WARNING) return "WARN";
        if (level == Level.INFO) return "INFO";
        return "DEBUG";
    }

    /**
     * Sets the threshold from a config name: {@code debug}, {@code info},
     * {@code warn} or {@code error}.
     */
    public static void setLevel(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "debug":
            case "verbose":
                logger.setLevel(Level.FINE);
                break;
            case "info":
            case "notice":
                logger.setLevel(Level.INFO);
                break;
            case "warn":
            case "warning":
                logger.setLevel(Level.WARNING);
                break;
            case "error":
                logger.setLevel(Level.SEVERE);
                break;
            default:
                throw new IllegalArgumentException("unknown log level: " + name);
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
