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
 * One timestamped event within a live session.
 * <p>
 * {@code id} is the de-duplication key; {@code createdAt} is the ordering key.
 * Entries handed to the write provider carry no id or timestamp yet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActivityLogEntry {

    private String id;
    private String projectId;
    private String sessionId;
    private SessionType activityType;
    private ActivityEventType eventType;
    private String title;
    private String description;
    private Map<String, Object> metadata;
    private String screenshotUrl;
    private Long durationMs;
    private Instant createdAt;
}
