package com.argus.activity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a single activity entry describes within its session.
 */
public enum ActivityEventType {
    STARTED("started"),
    STEP("step"),
    SCREENSHOT("screenshot"),
    THINKING("thinking"),
    ACTION("action"),
    ERROR("error"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wireName;

    ActivityEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ActivityEventType fromWire(String value) {
        return WireNames.lookup(ActivityEventType.class, values(), value, ActivityEventType::wireName);
    }
}
