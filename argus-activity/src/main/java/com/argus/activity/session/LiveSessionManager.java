package com.argus.activity.session;

import com.argus.activity.model.ActivityEventType;
import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.model.LiveSession;
import com.argus.activity.model.SessionStatus;
import com.argus.activity.model.SessionType;
import com.argus.activity.model.SessionUpdate;
import com.argus.activity.provider.ActivityWriteProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Producer side of live activity: opens a session for an automated run,
 * records what happens in it and closes it.
 * <p>
 * One manager serves one project context and tracks at most one current
 * session. Calls that need a current session are no-ops without one. Write
 * failures propagate as {@link com.argus.activity.provider.ActivityWriteException}.
 */
@Slf4j
public class LiveSessionManager {

    private final String projectId;
    private final ActivityWriteProvider writer;
    private final Clock clock;
    private final AtomicInteger pendingWrites = new AtomicInteger();

    private volatile LiveSession currentSession;

    public LiveSessionManager(String projectId, ActivityWriteProvider writer) {
        this(projectId, writer, Clock.systemUTC());
    }

    public LiveSessionManager(String projectId, ActivityWriteProvider writer, Clock clock) {
        this.projectId = projectId;
        this.writer = writer;
        this.clock = clock;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public LiveSession startSession(SessionType type) {
        return startSession(type, 0);
    }

    /**
     * Create a new active session, make it current and log its {@code started} entry.
     *
     * @return the created session, or null when there is no project context
     */
    public synchronized LiveSession startSession(SessionType type, int totalSteps) {
        if (projectId == null || projectId.isBlank()) {
            log.debug("No project context, not starting a {} session", type);
            return null;
        }
        if (type == null) {
            throw new IllegalArgumentException("sessionType is required");
        }
        if (totalSteps < 0) {
            throw new IllegalArgumentException("totalSteps must be >= 0, got " + totalSteps);
        }
        if (currentSession != null) {
            log.warn("Starting a new session while {} is still current; it will not be completed",
                    currentSession.getId());
        }

        LiveSession draft = LiveSession.builder()
                .projectId(projectId)
                .sessionType(type)
                .status(SessionStatus.ACTIVE)
                .totalSteps(totalSteps)
                .completedSteps(0)
                .startedAt(clock.instant())
                .metadata(new HashMap<>())
                .build();
        LiveSession created = tracked(() -> writer.createSession(draft));
        currentSession = created;
        log.info("Live session {} started ({}, {} steps)", created.getId(), type.wireName(), totalSteps);

        append(created, ActivityEventType.STARTED, type.label() + " started", null, null, null);
        return created;
    }

    /**
     * Write the final entry, mark the session completed or failed and clear the pointer.
     *
     * @return the final session, or null when nothing was current
     */
    public synchronized LiveSession completeSession(boolean success) {
        LiveSession session = currentSession;
        if (session == null) {
            log.debug("completeSession({}) without a current session", success);
            return null;
        }
        append(session, ActivityEventType.COMPLETED,
                success ? "Completed successfully" : "Failed", null, null, Map.of("success", success));
        return finish(session, success ? SessionStatus.COMPLETED : SessionStatus.FAILED);
    }

    /**
     * Abort the current session.
     *
     * @param reason optional description of the {@code cancelled} entry
     */
    public synchronized LiveSession cancelSession(String reason) {
        LiveSession session = currentSession;
        if (session == null) {
            log.debug("cancelSession without a current session");
            return null;
        }
        append(session, ActivityEventType.CANCELLED, "Cancelled", reason, null, null);
        return finish(session, SessionStatus.CANCELLED);
    }

    // =========================================================================
    // Activity
    // =========================================================================

    /**
     * Record a progress step and advance the session's step counter.
     */
    public synchronized void logStep(String title, String description, String screenshotUrl) {
        LiveSession session = currentSession;
        if (session == null) {
            log.debug("logStep '{}' without a current session", title);
            return;
        }
        append(session, ActivityEventType.STEP, title, description, screenshotUrl, null);

        SessionUpdate update = SessionUpdate.builder()
                .completedSteps(session.getCompletedSteps() + 1)
                .currentStep(title)
                .lastScreenshotUrl(screenshotUrl != null ? screenshotUrl : session.getLastScreenshotUrl())
                .build();
        currentSession = tracked(() -> writer.updateSession(session.getId(), update));
    }

    public void logStep(String title) {
        logStep(title, null, null);
    }

    public synchronized void logThinking(String thought) {
        LiveSession session = currentSession;
        if (session == null) {
            return;
        }
        append(session, ActivityEventType.THINKING, "AI Thinking", thought, null, null);
    }

    public synchronized void logError(String message) {
        LiveSession session = currentSession;
        if (session == null) {
            return;
        }
        append(session, ActivityEventType.ERROR, "Error", message, null, null);
    }

    public synchronized void logAction(String title, String description) {
        LiveSession session = currentSession;
        if (session == null) {
            return;
        }
        append(session, ActivityEventType.ACTION, title, description, null, null);
    }

    /**
     * Record a screenshot and make it the session's latest one.
     */
    public synchronized void logScreenshot(String url, String title) {
        LiveSession session = currentSession;
        if (session == null) {
            return;
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("screenshot url is required");
        }
        append(session, ActivityEventType.SCREENSHOT, title != null ? title : "Screenshot", null, url, null);
        SessionUpdate update = SessionUpdate.builder().lastScreenshotUrl(url).build();
        currentSession = tracked(() -> writer.updateSession(session.getId(), update));
    }

    // =========================================================================
    // State
    // =========================================================================

    public LiveSession getCurrentSession() {
        return currentSession;
    }

    /** True while a session create or update is in flight. */
    public boolean isLoading() {
        return pendingWrites.get() > 0;
    }

    public String getProjectId() {
        return projectId;
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private LiveSession finish(LiveSession session, SessionStatus status) {
        SessionUpdate update = SessionUpdate.builder()
                .status(status)
                .completedAt(clock.instant())
                .build();
        LiveSession done = tracked(() -> writer.updateSession(session.getId(), update));
        currentSession = null;
        log.info("Live session {} {}", session.getId(), status.wireName());
        return done;
    }

    private ActivityLogEntry append(LiveSession session, ActivityEventType eventType, String title,
                                    String description, String screenshotUrl, Map<String, Object> metadata) {
        ActivityLogEntry entry = ActivityLogEntry.builder()
                .projectId(session.getProjectId())
                .sessionId(session.getId())
                .activityType(session.getSessionType())
                .eventType(eventType)
                .title(title)
                .description(description)
                .screenshotUrl(screenshotUrl)
                .metadata(metadata != null ? metadata : Map.of())
                .build();
        return writer.appendActivity(entry);
    }

    private <T> T tracked(Supplier<T> write) {
        pendingWrites.incrementAndGet();
        try {
            return write.get();
        } finally {
            pendingWrites.decrementAndGet();
        }
    }
}
