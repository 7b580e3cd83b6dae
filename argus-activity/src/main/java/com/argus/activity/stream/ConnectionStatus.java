package com.argus.activity.stream;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of one push subscription.
 */
public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    /** Failed; either a retry is about to be scheduled or retries are exhausted. */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
