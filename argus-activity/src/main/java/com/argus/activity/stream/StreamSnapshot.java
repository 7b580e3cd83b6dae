package com.argus.activity.stream;

import com.argus.activity.model.ActivityLogEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * What a viewer renders: entries plus the connection view.
 *
 * @param sessionId        open session, or null when idle
 * @param entries          activity in display order
 * @param connectionStatus current status of the push subscription
 * @param lastHeartbeatAt  last ack or push, or null before the first one
 * @param reconnectAttempt automatic attempts since the last successful connect
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StreamSnapshot(String sessionId,
                             List<ActivityLogEntry> entries,
                             ConnectionStatus connectionStatus,
                             Instant lastHeartbeatAt,
                             int reconnectAttempt) {

    public static StreamSnapshot idle() {
        return new StreamSnapshot(null, List.of(), ConnectionStatus.DISCONNECTED, null, 0);
    }

    @JsonProperty("is_connected")
    public boolean isConnected() {
        return connectionStatus == ConnectionStatus.CONNECTED;
    }

    @JsonProperty("is_reconnecting")
    public boolean isReconnecting() {
        return connectionStatus == ConnectionStatus.RECONNECTING;
    }
}
