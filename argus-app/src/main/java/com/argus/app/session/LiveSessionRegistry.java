package com.argus.app.session;

import com.argus.activity.provider.ActivityWriteProvider;
import com.argus.activity.session.LiveSessionManager;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link LiveSessionManager} per project, created on first use.
 */
public class LiveSessionRegistry {

    private final ActivityWriteProvider writer;
    private final Clock clock;
    private final Map<String, LiveSessionManager> managers = new ConcurrentHashMap<>();

    public LiveSessionRegistry(ActivityWriteProvider writer, Clock clock) {
        this.writer = writer;
        this.clock = clock;
    }

    public LiveSessionManager forProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        return managers.computeIfAbsent(projectId, id -> new LiveSessionManager(id, writer, clock));
    }

    public int size() {
        return managers.size();
    }
}
