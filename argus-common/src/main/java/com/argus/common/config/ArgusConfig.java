package com.argus.common.config;

import com.argus.common.infra.Backoff;
import lombok.Data;

import java.util.List;

/**
 * Root configuration type for Argus.
 */
@Data
public class ArgusConfig {

    /** Live activity stream and reconnect tuning. */
    private StreamConfig stream;

    /** Session and activity retention. */
    private RetentionConfig retention;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class StreamConfig {
        private Long baseDelayMs;
        private Double multiplier;
        private Long maxDelayMs;
        /** Jitter ratio; 0.2 means +/-20% of the raw delay. */
        private Double jitter;
        private Integer maxAttempts;
        private Long heartbeatCheckIntervalMs;
        private Long heartbeatStaleMs;
        /** Re-fetch and merge the backlog after every reconnect. */
        private Boolean backfillOnReconnect;

        public Backoff.Policy toBackoffPolicy() {
            return new Backoff.Policy(baseDelayMs, maxDelayMs, multiplier, jitter);
        }
    }

    @Data
    public static class RetentionConfig {
        /** Active sessions older than this are marked failed. */
        private Integer staleSessionMinutes;
        private Integer activityRetentionDays;
        private Long sweepIntervalMs;
    }

    @Data
    public static class LoggingConfig {
        private String level;
        /** Subsystem prefixes allowed to log; empty means all. */
        private List<String> subsystems;
    }
}
