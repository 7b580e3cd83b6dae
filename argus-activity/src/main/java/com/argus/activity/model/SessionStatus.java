package com.argus.activity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return WireNames.lookup(SessionStatus.class, values(), value, SessionStatus::wireName);
    }
}
