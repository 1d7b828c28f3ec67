package work.lcod.html2wt.api;

import java.util.Locale;

/**
 * Diagnostic thresholds, ordered from most to least verbose.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Level of a log type such as {@code error/html2wt} or {@code warning}: its first path segment.
     */
    public static LogLevel fromLogType(String logType) {
        if (logType == null || logType.isBlank()) {
            return INFO;
        }
        var family = logType.split("/", 2)[0].trim().toLowerCase(Locale.ROOT);
        return switch (family) {
            case "fatal" -> FATAL;
            case "error" -> ERROR;
            case "warn", "warning" -> WARN;
            case "debug" -> DEBUG;
            case "trace" -> TRACE;
            default -> INFO;
        };
    }

    public boolean includes(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}
