package com.argus.activity.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Server-tracked record of one in-progress automated run.
 * {@code id} is assigned by the write provider on creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveSession {

    private String id;
    private String projectId;
    private SessionType sessionType;
    private SessionStatus status;

    /** Title of the most recent step. */
    private String currentStep;
    private int totalSteps;
    private int completedSteps;
    private String lastScreenshotUrl;

    private Instant startedAt;
    private Instant completedAt;

    private Map<String, Object> metadata;

    /**
     * Apply the non-null fields of a partial update, returning a new record.
     */
    public LiveSession apply(SessionUpdate update) {
        LiveSessionBuilder next = toBuilder();
        if (update.getStatus() != null) next.status(update.getStatus());
        if (update.getCurrentStep() != null) next.currentStep(update.getCurrentStep());
        if (update.getCompletedSteps() != null) next.completedSteps(update.getCompletedSteps());
        if (update.getLastScreenshotUrl() != null) next.lastScreenshotUrl(update.getLastScreenshotUrl());
        if (update.getCompletedAt() != null) next.completedAt(update.getCompletedAt());
        if (update.getMetadata() != null) next.metadata(update.getMetadata());
        return next.build();
    }
}
