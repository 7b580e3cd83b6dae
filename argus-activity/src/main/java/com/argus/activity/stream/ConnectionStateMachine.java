package com.argus.activity.stream;

import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.provider.PushSubscriptionProvider;
import com.argus.activity.provider.SubscriptionHandle;
import com.argus.activity.provider.SubscriptionStatus;
import com.argus.common.infra.Backoff;
import com.argus.common.infra.TaskTimers;
import com.argus.common.logging.SubsystemLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Owns the push subscription of one live session and keeps it alive.
 *
 * <pre>
 * disconnected --open--> connecting --ack--> connected
 * connecting|connected --error/timeout/stale--> error --> reconnecting --timer--> connecting
 * connecting|connected --peer close--> disconnected
 * any --teardown--> disconnected
 * </pre>
 *
 * After {@link ReconnectPolicy#maxAttempts()} automatic attempts without an ack
 * the machine stays in {@code error} until {@link #reconnect()} is called.
 * <p>
 * Every transition happens under one lock, which may be shared with the owner.
 * Each subscribe bumps a generation counter; callbacks and timers that belong to
 * an older generation are dropped.
 */
public class ConnectionStateMachine {

    private static final SubsystemLogger log = SubsystemLogger.create("activity/stream");

    private final Object lock;
    private final PushSubscriptionProvider provider;
    private final TaskTimers timers;
    private final Clock clock;
    private final ReconnectPolicy policy;
    private final DoubleSupplier random;
    private final ConnectionListener listener;

    // guarded by lock
    private String sessionId;
    private String topic;
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private int reconnectAttempt;
    private Instant lastHeartbeatAt;
    private SubscriptionHandle handle;
    private long generation;
    private TaskTimers.Timer retryTimer;
    private TaskTimers.Timer watchdogTimer;
    private boolean resumed;
    private long lastScheduledDelayMs = -1;

    public ConnectionStateMachine(Object lock,
                                  PushSubscriptionProvider provider,
                                  TaskTimers timers,
                                  Clock clock,
                                  ReconnectPolicy policy,
                                  DoubleSupplier random,
                                  ConnectionListener listener) {
        this.lock = lock != null ? lock : new Object();
        this.provider = provider;
        this.timers = timers;
        this.clock = clock;
        this.policy = policy;
        this.random = random;
        this.listener = listener;
    }

    // ==================== Commands ====================

    /**
     * Start the subscription for a session, releasing any previous one.
     * A null or blank id leaves the machine disconnected without touching the provider.
     */
    public void open(String sessionId) {
        synchronized (lock) {
            teardownLocked();
            if (sessionId == null || sessionId.isBlank()) {
                this.sessionId = null;
                this.topic = null;
                return;
            }
            this.sessionId = sessionId;
            this.topic = PushSubscriptionProvider.topicFor(sessionId);
            this.resumed = false;
            subscribeLocked();
        }
    }

    /**
     * Manual reconnect: teardown, reset the attempt counter, open again.
     * Available in every state; a no-op when no session is open.
     */
    public void reconnect() {
        synchronized (lock) {
            String id = sessionId;
            teardownLocked();
            if (id == null) {
                return;
            }
            log.info("Manual reconnect", Map.of("topic", topic));
            resumed = true;
            subscribeLocked();
        }
    }

    /**
     * Release the subscription and cancel every timer.
     */
    public void close() {
        synchronized (lock) {
            teardownLocked();
            sessionId = null;
            topic = null;
        }
    }

    // ==================== Queries ====================

    public ConnectionStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public int reconnectAttempt() {
        synchronized (lock) {
            return reconnectAttempt;
        }
    }

    public Instant lastHeartbeatAt() {
        synchronized (lock) {
            return lastHeartbeatAt;
        }
    }

    public String sessionId() {
        synchronized (lock) {
            return sessionId;
        }
    }

    /** True while a backoff timer is waiting to re-subscribe. */
    public boolean hasPendingRetry() {
        synchronized (lock) {
            return retryTimer != null && !retryTimer.isCancelled();
        }
    }

    /** Delay of the most recently scheduled retry, or -1 if none was scheduled. */
    public long lastScheduledDelayMs() {
        synchronized (lock) {
            return lastScheduledDelayMs;
        }
    }

    // ==================== Provider callbacks ====================

    private void onStatus(long gen, SubscriptionStatus signal) {
        synchronized (lock) {
            if (gen != generation) {
                log.debug("Dropping status from released subscription", Map.of("signal", signal));
                return;
            }
            switch (signal) {
                case SUBSCRIBED -> onAckLocked();
                case CHANNEL_ERROR, TIMED_OUT -> {
                    if (status == ConnectionStatus.CONNECTING || status == ConnectionStatus.CONNECTED) {
                        failLocked(signal.name().toLowerCase());
                    }
                }
                case CLOSED -> {
                    if (status == ConnectionStatus.CONNECTING || status == ConnectionStatus.CONNECTED) {
                        log.info("Channel closed by peer", Map.of("topic", topic));
                        cancelWatchdogLocked();
                        releaseSubscriptionLocked();
                        transition(ConnectionStatus.DISCONNECTED);
                    }
                }
            }
        }
    }

    private void onEvent(long gen, ActivityLogEntry entry) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            lastHeartbeatAt = clock.instant();
            try {
                listener.onEntry(entry);
            } catch (Exception e) {
                log.error("Activity listener failed", e);
            }
        }
    }

    private void onAckLocked() {
        lastHeartbeatAt = clock.instant();
        if (status != ConnectionStatus.CONNECTING) {
            return;
        }
        reconnectAttempt = 0;
        transition(ConnectionStatus.CONNECTED);
        startWatchdogLocked();
        if (resumed) {
            resumed = false;
            try {
                listener.onResumed();
            } catch (Exception e) {
                log.error("Resume listener failed", e);
            }
        }
    }

    // ==================== Internals ====================

    private void subscribeLocked() {
        long gen = ++generation;
        transition(ConnectionStatus.CONNECTING);
        log.debug("Subscribing", Map.of("topic", topic, "attempt", reconnectAttempt));

        SubscriptionHandle opened;
        try {
            opened = provider.subscribe(topic,
                    entry -> onEvent(gen, entry),
                    signal -> onStatus(gen, signal));
        } catch (RuntimeException e) {
            log.warn("Subscribe failed", Map.of("topic", topic, "error", String.valueOf(e.getMessage())));
            if (gen == generation) {
                failLocked("subscribe threw");
            }
            return;
        }

        if (gen != generation) {
            // released while the handshake was still running
            unsubscribeQuietly(opened);
            return;
        }
        handle = opened;
    }

    private void failLocked(String reason) {
        cancelWatchdogLocked();
        releaseSubscriptionLocked();
        transition(ConnectionStatus.ERROR);

        if (reconnectAttempt >= policy.maxAttempts()) {
            log.warn("Reconnect attempts exhausted; waiting for manual reconnect",
                    meta("reason", reason));
            return;
        }

        long delay = Backoff.compute(policy.backoff(), reconnectAttempt, random);
        reconnectAttempt++;
        resumed = true;
        lastScheduledDelayMs = delay;
        long gen = generation;
        transition(ConnectionStatus.RECONNECTING);
        retryTimer = timers.schedule(() -> onRetryTimer(gen), delay, "activity-reconnect");
        log.warn("Connection failed, retry scheduled", meta("reason", reason, "delayMs", delay));
    }

    private void onRetryTimer(long gen) {
        synchronized (lock) {
            if (gen != generation || status != ConnectionStatus.RECONNECTING) {
                return;
            }
            retryTimer = null;
            subscribeLocked();
        }
    }

    private void startWatchdogLocked() {
        cancelWatchdogLocked();
        long gen = generation;
        watchdogTimer = timers.scheduleRepeating(() -> checkHeartbeat(gen),
                policy.heartbeatCheckIntervalMs(), "activity-heartbeat-watchdog");
    }

    private void checkHeartbeat(long gen) {
        synchronized (lock) {
            if (gen != generation || status != ConnectionStatus.CONNECTED || lastHeartbeatAt == null) {
                return;
            }
            long silentMs = Duration.between(lastHeartbeatAt, clock.instant()).toMillis();
            if (silentMs > policy.heartbeatStaleMs()) {
                log.warn("Heartbeat stale, forcing reconnect", meta("silentMs", silentMs));
                failLocked("heartbeat stale");
            }
        }
    }

    private void teardownLocked() {
        if (retryTimer != null) {
            retryTimer.cancel();
            retryTimer = null;
        }
        cancelWatchdogLocked();
        releaseSubscriptionLocked();
        reconnectAttempt = 0;
        transition(ConnectionStatus.DISCONNECTED);
    }

    private void cancelWatchdogLocked() {
        if (watchdogTimer != null) {
            watchdogTimer.cancel();
            watchdogTimer = null;
        }
    }

    private void releaseSubscriptionLocked() {
        generation++;
        SubscriptionHandle released = handle;
        handle = null;
        if (released != null) {
            unsubscribeQuietly(released);
        }
    }

    private void unsubscribeQuietly(SubscriptionHandle released) {
        try {
            provider.unsubscribe(released);
        } catch (RuntimeException e) {
            log.warn("Unsubscribe failed", Map.of("topic", released.topic(),
                    "error", String.valueOf(e.getMessage())));
        }
    }

    private void transition(ConnectionStatus next) {
        ConnectionStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        log.debug("Connection " + previous.wireName() + " -> " + next.wireName(),
                topic != null ? Map.of("topic", topic) : null);
        try {
            listener.onStatusChange(previous, next);
        } catch (Exception e) {
            log.error("Status listener failed", e);
        }
    }

    private Map<String, Object> meta(Object... kv) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("topic", topic);
        meta.put("attempt", reconnectAttempt);
        for (int i = 0; i + 1 < kv.length; i += 2) {
            meta.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return meta;
    }
}
