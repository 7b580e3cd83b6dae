package com.argus.app.stream;

import com.argus.activity.provider.BacklogProvider;
import com.argus.activity.provider.PushSubscriptionProvider;
import com.argus.activity.stream.ActivityStreamController;
import com.argus.activity.stream.ConnectionStatus;
import com.argus.activity.stream.ReconnectPolicy;
import com.argus.activity.stream.StreamSnapshot;
import com.argus.common.config.ConfigService;
import com.argus.common.infra.TaskTimers;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Server-side viewers: at most one {@link ActivityStreamController} per session id.
 * Reconnect tuning is read from the {@code stream} config section when a viewer opens.
 */
@Slf4j
public class ActivityStreamRegistry {

    private final PushSubscriptionProvider push;
    private final BacklogProvider backlog;
    private final TaskTimers timers;
    private final ConfigService configService;
    private final Clock clock;
    private final Map<String, ActivityStreamController> viewers = new ConcurrentHashMap<>();

    public ActivityStreamRegistry(PushSubscriptionProvider push,
                                  BacklogProvider backlog,
                                  TaskTimers timers,
                                  ConfigService configService,
                                  Clock clock) {
        this.push = push;
        this.backlog = backlog;
        this.timers = timers;
        this.configService = configService;
        this.clock = clock;
    }

    /**
     * Return the viewer of a session, opening it on first request.
     */
    public ActivityStreamController open(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return viewers.computeIfAbsent(sessionId, id -> {
            ReconnectPolicy policy = ReconnectPolicy.from(configService.loadConfig().getStream());
            ActivityStreamController controller = new ActivityStreamController(push, backlog, timers, clock,
                    policy, () -> ThreadLocalRandom.current().nextDouble());
            controller.open(id);
            log.info("Opened activity viewer for session {}", id);
            return controller;
        });
    }

    public Optional<ActivityStreamController> get(String sessionId) {
        return Optional.ofNullable(sessionId).map(viewers::get);
    }

    /**
     * @return the snapshot after the reconnect, or empty when no viewer is open
     */
    public Optional<StreamSnapshot> reconnect(String sessionId) {
        return get(sessionId).map(controller -> {
            controller.reconnect();
            return controller.getSnapshot();
        });
    }

    /**
     * @return true when a viewer was open and is now closed
     */
    public boolean close(String sessionId) {
        ActivityStreamController controller = sessionId != null ? viewers.remove(sessionId) : null;
        if (controller == null) {
            return false;
        }
        controller.close();
        log.info("Closed activity viewer for session {}", sessionId);
        return true;
    }

    public int viewerCount() {
        return viewers.size();
    }

    /** Snapshot listeners across all viewers, one per attached SSE stream. */
    public int listenerCount() {
        return viewers.values().stream().mapToInt(ActivityStreamController::listenerCount).sum();
    }

    /**
     * Connection status per open session, ordered by session id.
     */
    public Map<String, ConnectionStatus> connectionStates() {
        Map<String, ConnectionStatus> states = new TreeMap<>();
        viewers.forEach((id, controller) -> states.put(id, controller.getSnapshot().connectionStatus()));
        return states;
    }

    /**
     * Number of viewers per connection status.
     */
    public Map<ConnectionStatus, Integer> statusCounts() {
        Map<ConnectionStatus, Integer> counts = new LinkedHashMap<>();
        for (ConnectionStatus status : connectionStates().values()) {
            counts.merge(status, 1, Integer::sum);
        }
        return counts;
    }

    @PreDestroy
    public void closeAll() {
        viewers.keySet().forEach(this::close);
    }
}
