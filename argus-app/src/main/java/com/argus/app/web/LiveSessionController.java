package com.argus.app.web;

import com.argus.activity.model.LiveSession;
import com.argus.activity.provider.LiveSessionQuery;
import com.argus.activity.session.LiveSessionManager;
import com.argus.app.session.LiveSessionRegistry;
import com.argus.app.web.ActivityApiTypes.ActionRequest;
import com.argus.app.web.ActivityApiTypes.CancelRequest;
import com.argus.app.web.ActivityApiTypes.CompleteRequest;
import com.argus.app.web.ActivityApiTypes.StartSessionRequest;
import com.argus.app.web.ActivityApiTypes.StepRequest;
import com.argus.app.web.ActivityApiTypes.TextRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Producer API: automated runs report their progress here.
 */
@Slf4j
@RestController
@RequestMapping("/api/projects/{projectId}/sessions")
public class LiveSessionController {

    private final LiveSessionRegistry sessions;
    private final LiveSessionQuery query;

    public LiveSessionController(LiveSessionRegistry sessions, LiveSessionQuery query) {
        this.sessions = sessions;
        this.query = query;
    }

    @PostMapping
    public LiveSession start(@PathVariable String projectId, @RequestBody StartSessionRequest request) {
        if (request.sessionType() == null) {
            throw new IllegalArgumentException("sessionType is required");
        }
        int totalSteps = request.totalSteps() != null ? request.totalSteps() : 0;
        return sessions.forProject(projectId).startSession(request.sessionType(), totalSteps);
    }

    @GetMapping("/current")
    public ResponseEntity<LiveSession> current(@PathVariable String projectId) {
        LiveSession session = sessions.forProject(projectId).getCurrentSession();
        return session != null ? ResponseEntity.ok(session) : ResponseEntity.noContent().build();
    }

    @GetMapping("/active")
    public List<LiveSession> active(@PathVariable String projectId) {
        return query.listActiveSessions(projectId);
    }

    @PostMapping("/current/steps")
    public LiveSession step(@PathVariable String projectId, @RequestBody StepRequest request) {
        requireText(request.title(), "title");
        LiveSessionManager manager = requireCurrent(projectId);
        manager.logStep(request.title(), request.description(), request.screenshotUrl());
        return manager.getCurrentSession();
    }

    @PostMapping("/current/thinking")
    public ResponseEntity<Void> thinking(@PathVariable String projectId, @RequestBody TextRequest request) {
        requireText(request.text(), "text");
        requireCurrent(projectId).logThinking(request.text());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/current/errors")
    public ResponseEntity<Void> error(@PathVariable String projectId, @RequestBody TextRequest request) {
        requireText(request.text(), "text");
        requireCurrent(projectId).logError(request.text());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/current/actions")
    public ResponseEntity<Void> action(@PathVariable String projectId, @RequestBody ActionRequest request) {
        requireText(request.title(), "title");
        requireCurrent(projectId).logAction(request.title(), request.description());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/current/complete")
    public LiveSession complete(@PathVariable String projectId, @RequestBody CompleteRequest request) {
        if (request.success() == null) {
            throw new IllegalArgumentException("success is required");
        }
        return requireCurrent(projectId).completeSession(request.success());
    }

    @PostMapping("/current/cancel")
    public LiveSession cancel(@PathVariable String projectId,
                              @RequestBody(required = false) CancelRequest request) {
        return requireCurrent(projectId).cancelSession(request != null ? request.reason() : null);
    }

    private LiveSessionManager requireCurrent(String projectId) {
        LiveSessionManager manager = sessions.forProject(projectId);
        if (manager.getCurrentSession() == null) {
            throw new NoCurrentSessionException(projectId);
        }
        return manager;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
