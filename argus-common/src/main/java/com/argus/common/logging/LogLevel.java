package com.argus.common.logging;

/**
 * Level names accepted in the {@code logging.level} config entry.
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    /**
     * Resolve a configured level, accepting {@code off}, {@code fatal} and
     * {@code warning} as aliases. Unknown or blank values yield {@code fallback}.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        return switch (level.trim().toLowerCase()) {
            case "silent", "off" -> SILENT;
            case "error", "fatal" -> ERROR;
            case "warn", "warning" -> WARN;
            case "info" -> INFO;
            case "debug" -> DEBUG;
            case "trace" -> TRACE;
            default -> fallback;
        };
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /** Level name understood by Logback and Spring's {@code LoggingSystem}. */
    public String toSlf4jLevel() {
        return this == SILENT ? "OFF" : name();
    }
}
