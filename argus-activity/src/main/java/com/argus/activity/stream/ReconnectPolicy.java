package com.argus.activity.stream;

import com.argus.common.config.ArgusConfig;
import com.argus.common.infra.Backoff;

/**
 * Reconnect and liveness tuning for one stream.
 *
 * @param backoff                  delay policy between automatic attempts
 * @param maxAttempts              automatic attempts before going dormant
 * @param heartbeatCheckIntervalMs period of the staleness check while connected
 * @param heartbeatStaleMs         silence after which a connection counts as dead
 * @param backfillOnReconnect      re-fetch the backlog after each reconnect
 */
public record ReconnectPolicy(Backoff.Policy backoff,
                              int maxAttempts,
                              long heartbeatCheckIntervalMs,
                              long heartbeatStaleMs,
                              boolean backfillOnReconnect) {

    public static final ReconnectPolicy DEFAULT =
            new ReconnectPolicy(Backoff.Policy.DEFAULT, 5, 10_000, 30_000, false);

    public ReconnectPolicy {
        if (backoff == null) {
            throw new IllegalArgumentException("backoff policy is required");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        if (heartbeatCheckIntervalMs <= 0 || heartbeatStaleMs <= 0) {
            throw new IllegalArgumentException("heartbeat intervals must be > 0");
        }
    }

    public static ReconnectPolicy from(ArgusConfig.StreamConfig config) {
        return new ReconnectPolicy(
                config.toBackoffPolicy(),
                config.getMaxAttempts(),
                config.getHeartbeatCheckIntervalMs(),
                config.getHeartbeatStaleMs(),
                config.getBackfillOnReconnect());
    }

    public ReconnectPolicy withBackfillOnReconnect(boolean enabled) {
        return new ReconnectPolicy(backoff, maxAttempts, heartbeatCheckIntervalMs, heartbeatStaleMs, enabled);
    }
}
