package com.argus.activity.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of automated run a live session tracks.
 * The same values tag each activity entry of the session.
 */
public enum SessionType {
    DISCOVERY("discovery"),
    VISUAL_TEST("visual_test"),
    TEST_RUN("test_run"),
    QUALITY_AUDIT("quality_audit"),
    GLOBAL_TEST("global_test");

    private final String wireName;

    SessionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Human label used in "started" titles: only the first underscore becomes a space.
     */
    public String label() {
        return wireName.replaceFirst("_", " ");
    }

    @JsonCreator
    public static SessionType fromWire(String value) {
        return WireNames.lookup(SessionType.class, values(), value, SessionType::wireName);
    }
}
