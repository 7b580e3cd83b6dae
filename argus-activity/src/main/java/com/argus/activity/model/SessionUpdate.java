package com.argus.activity.model;

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
 * Partial update of a {@link LiveSession}; null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionUpdate {

    private SessionStatus status;
    private String currentStep;
    private Integer completedSteps;
    private String lastScreenshotUrl;
    private Instant completedAt;
    private Map<String, Object> metadata;
}
