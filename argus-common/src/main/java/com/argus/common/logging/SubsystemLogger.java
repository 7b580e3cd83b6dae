package com.argus.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Logger for the live activity subsystems ({@code activity/stream},
 * {@code activity/session}, ...).
 * <p>
 * The SLF4J logger is {@code argus.<subsystem>} with slashes turned into dots.
 * Metadata keys {@value #MDC_TOPIC} and {@value #MDC_SESSION} are lifted into the
 * MDC for the duration of the call, so appenders can group lines by channel or
 * session; every other key is appended to the message as {@code key=value}.
 */
public final class SubsystemLogger {

    public static final String MDC_SUBSYSTEM = "subsystem";
    public static final String MDC_TOPIC = "topic";
    public static final String MDC_SESSION = "sessionId";

    private static final Set<String> CONTEXT_KEYS = Set.of(MDC_TOPIC, MDC_SESSION);
    private static final List<String> enabledPrefixes = new CopyOnWriteArrayList<>();

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("argus." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        if (subsystem == null || subsystem.isBlank()) {
            throw new IllegalArgumentException("subsystem is required");
        }
        return new SubsystemLogger(subsystem);
    }

    public void debug(String message, Map<String, ?> meta) {
        log(Level.DEBUG, message, meta, null);
    }

    public void info(String message, Map<String, ?> meta) {
        log(Level.INFO, message, meta, null);
    }

    public void warn(String message) {
        log(Level.WARN, message, null, null);
    }

    public void warn(String message, Map<String, ?> meta) {
        log(Level.WARN, message, meta, null);
    }

    public void error(String message, Throwable cause) {
        log(Level.ERROR, message, null, cause);
    }

    /**
     * Restrict output to the given subsystem prefixes ({@code "activity"} matches
     * {@code activity/stream}). No prefixes enables every subsystem.
     */
    public static void setSubsystemFilter(String... prefixes) {
        List<String> next = new ArrayList<>();
        if (prefixes != null) {
            for (String prefix : prefixes) {
                if (prefix != null && !prefix.isBlank()) {
                    next.add(prefix.trim());
                }
            }
        }
        enabledPrefixes.clear();
        enabledPrefixes.addAll(next);
    }

    boolean shouldLog() {
        if (enabledPrefixes.isEmpty()) {
            return true;
        }
        for (String prefix : enabledPrefixes) {
            if (subsystem.equals(prefix) || subsystem.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private void log(Level level, String message, Map<String, ?> meta, Throwable cause) {
        if (!shouldLog() || !logger.isEnabledForLevel(level)) {
            return;
        }
        List<String> pushed = new ArrayList<>(3);
        try {
            put(MDC_SUBSYSTEM, subsystem, pushed);
            if (meta != null) {
                for (String key : CONTEXT_KEYS) {
                    Object value = meta.get(key);
                    if (value != null) {
                        put(key, value.toString(), pushed);
                    }
                }
            }
            logger.atLevel(level).setCause(cause).log(render(message, meta));
        } finally {
            pushed.forEach(MDC::remove);
        }
    }

    private static void put(String key, String value, List<String> pushed) {
        MDC.put(key, value);
        pushed.add(key);
    }

    /** Message followed by the non-context metadata as {@code key=value} pairs. */
    static String render(String message, Map<String, ?> meta) {
        if (meta == null || meta.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message);
        meta.forEach((key, value) -> {
            if (!CONTEXT_KEYS.contains(key)) {
                sb.append(' ').append(key).append('=').append(value);
            }
        });
        return sb.toString();
    }
}
