package com.argus.app.web;

import com.argus.activity.model.SessionType;

/**
 * Request bodies of the live session API.
 */
public final class ActivityApiTypes {

    private ActivityApiTypes() {
    }

    public record StartSessionRequest(SessionType sessionType, Integer totalSteps) {
    }

    public record StepRequest(String title, String description, String screenshotUrl) {
    }

    /** Body of thinking and error entries. */
    public record TextRequest(String text) {
    }

    public record ActionRequest(String title, String description) {
    }

    public record CompleteRequest(Boolean success) {
    }

    public record CancelRequest(String reason) {
    }
}
