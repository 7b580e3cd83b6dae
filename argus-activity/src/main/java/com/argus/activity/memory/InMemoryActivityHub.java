package com.argus.activity.memory;

import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.model.LiveSession;
import com.argus.activity.model.SessionStatus;
import com.argus.activity.model.SessionUpdate;
import com.argus.activity.provider.ActivityWriteException;
import com.argus.activity.provider.ActivityWriteProvider;
import com.argus.activity.provider.BacklogProvider;
import com.argus.activity.provider.LiveSessionQuery;
import com.argus.activity.provider.PushSubscriptionProvider;
import com.argus.activity.provider.SubscriptionHandle;
import com.argus.activity.provider.SubscriptionStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Process-local activity backend: stores sessions and entries and pushes new
 * entries to subscribers of {@code activity-<sessionId>}.
 * <p>
 * Subscriber callbacks are invoked on the writing thread after the hub has
 * released its own locks.
 */
@Slf4j
public class InMemoryActivityHub
        implements PushSubscriptionProvider, BacklogProvider, ActivityWriteProvider, LiveSessionQuery {

    public static final Duration DEFAULT_STALE_SESSION_AGE = Duration.ofMinutes(10);
    public static final Duration DEFAULT_ACTIVITY_RETENTION = Duration.ofDays(7);

    /**
     * Live subscription on one topic.
     */
    record Subscription(String id,
                        String topic,
                        Consumer<ActivityLogEntry> onEvent,
                        Consumer<SubscriptionStatus> onStatus) implements SubscriptionHandle {
    }

    private final Clock clock;
    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<ActivityLogEntry>> activity = new ConcurrentHashMap<>();
    private final Map<String, Set<Subscription>> subscribers = new ConcurrentHashMap<>();

    public InMemoryActivityHub() {
        this(Clock.systemUTC());
    }

    public InMemoryActivityHub(Clock clock) {
        this.clock = clock;
    }

    // =========================================================================
    // Push
    // =========================================================================

    @Override
    public SubscriptionHandle subscribe(String topic,
                                        Consumer<ActivityLogEntry> onEvent,
                                        Consumer<SubscriptionStatus> onStatus) {
        if (topic == null || !topic.startsWith(TOPIC_PREFIX)) {
            throw new IllegalArgumentException("Unknown topic: " + topic);
        }
        Subscription sub = new Subscription(UUID.randomUUID().toString(), topic, onEvent, onStatus);
        subscribers.computeIfAbsent(topic, k -> ConcurrentHashMap.newKeySet()).add(sub);
        log.debug("Subscribed {} to {}", sub.id(), topic);
        signal(sub, SubscriptionStatus.SUBSCRIBED);
        return sub;
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle) {
        if (!(handle instanceof Subscription sub)) {
            return;
        }
        Set<Subscription> subs = subscribers.get(sub.topic());
        if (subs != null && subs.remove(sub)) {
            log.debug("Unsubscribed {} from {}", sub.id(), sub.topic());
        }
    }

    /**
     * Close every subscription on a topic from the server side.
     *
     * @return number of subscriptions closed
     */
    public int closeTopic(String topic) {
        return dropTopic(topic, SubscriptionStatus.CLOSED);
    }

    /**
     * Report a channel failure to every subscriber of a topic and drop them.
     *
     * @param status {@code CHANNEL_ERROR} or {@code TIMED_OUT}
     */
    public int failTopic(String topic, SubscriptionStatus status) {
        if (status != SubscriptionStatus.CHANNEL_ERROR && status != SubscriptionStatus.TIMED_OUT) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return dropTopic(topic, status);
    }

    public int subscriberCount(String topic) {
        Set<Subscription> subs = subscribers.get(topic);
        return subs != null ? subs.size() : 0;
    }

    private int dropTopic(String topic, SubscriptionStatus status) {
        Set<Subscription> subs = subscribers.remove(topic);
        if (subs == null || subs.isEmpty()) {
            return 0;
        }
        log.info("Dropping {} subscriber(s) of {} with {}", subs.size(), topic, status);
        for (Subscription sub : subs) {
            signal(sub, status);
        }
        return subs.size();
    }

    // =========================================================================
    // Writes
    // =========================================================================

    @Override
    public LiveSession createSession(LiveSession session) {
        if (session == null || session.getProjectId() == null || session.getSessionType() == null) {
            throw new ActivityWriteException("createSession", "projectId and sessionType are required");
        }
        LiveSession stored = session.toBuilder()
                .id(UUID.randomUUID().toString())
                .status(session.getStatus() != null ? session.getStatus() : SessionStatus.ACTIVE)
                .startedAt(clock.instant())
                .metadata(session.getMetadata() != null ? new HashMap<>(session.getMetadata()) : new HashMap<>())
                .build();
        sessions.put(stored.getId(), stored);
        activity.put(stored.getId(), new ArrayList<>());
        return stored;
    }

    @Override
    public LiveSession updateSession(String sessionId, SessionUpdate update) {
        if (sessionId == null || update == null) {
            throw new ActivityWriteException("updateSession", "sessionId and update are required");
        }
        LiveSession updated = sessions.computeIfPresent(sessionId, (id, current) -> current.apply(update));
        if (updated == null) {
            throw new ActivityWriteException("updateSession", "no session " + sessionId);
        }
        return updated;
    }

    @Override
    public ActivityLogEntry appendActivity(ActivityLogEntry entry) {
        if (entry == null || entry.getSessionId() == null) {
            throw new ActivityWriteException("appendActivity", "sessionId is required");
        }
        if (entry.getEventType() == null || entry.getTitle() == null || entry.getTitle().isBlank()) {
            throw new ActivityWriteException("appendActivity", "eventType and title are required");
        }
        ActivityLogEntry stored = entry.toBuilder()
                .id(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .build();
        List<ActivityLogEntry> rows = activity.computeIfAbsent(stored.getSessionId(), k -> new ArrayList<>());
        synchronized (rows) {
            rows.add(stored);
        }
        deliver(stored);
        return stored;
    }

    // =========================================================================
    // Reads
    // =========================================================================

    @Override
    public List<ActivityLogEntry> fetchBacklog(String sessionId) {
        List<ActivityLogEntry> rows = activity.get(sessionId);
        if (rows == null) {
            return List.of();
        }
        List<ActivityLogEntry> copy;
        synchronized (rows) {
            copy = new ArrayList<>(rows);
        }
        copy.sort(Comparator.comparing(ActivityLogEntry::getCreatedAt));
        return copy;
    }

    @Override
    public List<LiveSession> listActiveSessions(String projectId) {
        return sessions.values().stream()
                .filter(s -> s.getStatus() == SessionStatus.ACTIVE)
                .filter(s -> projectId == null || projectId.equals(s.getProjectId()))
                .sorted(Comparator.comparing(LiveSession::getStartedAt).reversed())
                .toList();
    }

    public Optional<LiveSession> getSession(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    // =========================================================================
    // Maintenance
    // =========================================================================

    /**
     * Mark active sessions started before {@code now - maxAge} as failed.
     *
     * @return number of sessions failed
     */
    public int failStaleSessions(Duration maxAge) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(maxAge);
        SessionUpdate update = SessionUpdate.builder()
                .status(SessionStatus.FAILED)
                .completedAt(now)
                .build();
        AtomicInteger counter = new AtomicInteger();
        for (String id : sessions.keySet()) {
            sessions.computeIfPresent(id, (key, current) -> {
                if (current.getStatus() != SessionStatus.ACTIVE || !current.getStartedAt().isBefore(cutoff)) {
                    return current;
                }
                counter.incrementAndGet();
                return current.apply(update);
            });
        }
        int failed = counter.get();
        if (failed > 0) {
            log.info("Marked {} stale live session(s) as failed", failed);
        }
        return failed;
    }

    /**
     * Delete entries created before {@code now - maxAge}.
     *
     * @return number of entries removed
     */
    public int pruneActivityOlderThan(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (List<ActivityLogEntry> rows : activity.values()) {
            synchronized (rows) {
                int before = rows.size();
                rows.removeIf(e -> e.getCreatedAt().isBefore(cutoff));
                removed += before - rows.size();
            }
        }
        if (removed > 0) {
            log.info("Pruned {} activity entr(ies) older than {}", removed, maxAge);
        }
        return removed;
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private void deliver(ActivityLogEntry entry) {
        Set<Subscription> subs = subscribers.get(PushSubscriptionProvider.topicFor(entry.getSessionId()));
        if (subs == null) {
            return;
        }
        for (Subscription sub : List.copyOf(subs)) {
            try {
                sub.onEvent().accept(entry);
            } catch (RuntimeException e) {
                log.warn("Subscriber {} failed on {}: {}", sub.id(), sub.topic(), e.getMessage());
            }
        }
    }

    private void signal(Subscription sub, SubscriptionStatus status) {
        try {
            sub.onStatus().accept(status);
        } catch (RuntimeException e) {
            log.warn("Subscriber {} failed on status {}: {}", sub.id(), status, e.getMessage());
        }
    }
}
