package com.argus.activity.stream;

import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.provider.BacklogProvider;
import com.argus.activity.provider.PushSubscriptionProvider;
import com.argus.common.infra.TaskTimers;
import com.argus.common.logging.SubsystemLogger;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * Live activity view of one session for one viewer.
 * <p>
 * {@link #open(String)} seeds the buffer from the backlog and then keeps it
 * current from the push channel. Connectivity problems never surface as
 * exceptions; they show up in {@link StreamSnapshot#connectionStatus()}.
 * <p>
 * Snapshot listeners run on whichever thread caused the change, with the
 * controller lock held. That thread may be a producer writing activity, so a
 * listener that does I/O hands the snapshot to its own thread and returns.
 */
public class ActivityStreamController implements AutoCloseable {

    private static final SubsystemLogger log = SubsystemLogger.create("activity/stream");

    private final Object lock = new Object();
    private final BacklogProvider backlog;
    private final TaskTimers timers;
    private final ReconnectPolicy policy;
    private final ConnectionStateMachine connection;
    private final ActivityBuffer buffer = new ActivityBuffer();
    private final List<Consumer<StreamSnapshot>> listeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private String sessionId;
    private TaskTimers.Timer backfillTimer;
    private long backfillGeneration;

    public ActivityStreamController(PushSubscriptionProvider push,
                                    BacklogProvider backlog,
                                    TaskTimers timers) {
        this(push, backlog, timers, Clock.systemUTC(), ReconnectPolicy.DEFAULT,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public ActivityStreamController(PushSubscriptionProvider push,
                                    BacklogProvider backlog,
                                    TaskTimers timers,
                                    Clock clock,
                                    ReconnectPolicy policy,
                                    DoubleSupplier random) {
        this.backlog = backlog;
        this.timers = timers;
        this.policy = policy;
        this.connection = new ConnectionStateMachine(lock, push, timers, clock, policy, random,
                new Listener());
    }

    /**
     * Show a session. Any previously open session is torn down first.
     * A null or blank id leaves the controller idle.
     */
    public void open(String sessionId) {
        synchronized (lock) {
            connection.close();
            cancelBackfillLocked();
            buffer.clear();
            if (sessionId == null || sessionId.isBlank()) {
                this.sessionId = null;
                notifyListeners();
                return;
            }
            this.sessionId = sessionId;
            buffer.seed(fetchBacklogSafely(sessionId));
            connection.open(sessionId);
            notifyListeners();
        }
    }

    /**
     * Manual reconnect, also after automatic retries are exhausted.
     */
    public void reconnect() {
        synchronized (lock) {
            connection.reconnect();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            connection.close();
            cancelBackfillLocked();
            buffer.clear();
            sessionId = null;
            notifyListeners();
        }
    }

    public StreamSnapshot getSnapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    public List<ActivityLogEntry> entries() {
        synchronized (lock) {
            return buffer.snapshot();
        }
    }

    public String getSessionId() {
        synchronized (lock) {
            return sessionId;
        }
    }

    public ReconnectPolicy getPolicy() {
        return policy;
    }

    /**
     * Register a listener notified after every status change or appended entry.
     *
     * @return action removing the listener
     */
    public Runnable addSnapshotListener(Consumer<StreamSnapshot> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    // ==================== Internals ====================

    private StreamSnapshot snapshotLocked() {
        return new StreamSnapshot(
                sessionId,
                buffer.snapshot(),
                connection.status(),
                connection.lastHeartbeatAt(),
                connection.reconnectAttempt());
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        StreamSnapshot snapshot = snapshotLocked();
        for (Consumer<StreamSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (Exception e) {
                log.error("Snapshot listener failed", e);
            }
        }
    }

    private List<ActivityLogEntry> fetchBacklogSafely(String id) {
        try {
            List<ActivityLogEntry> rows = backlog.fetchBacklog(id);
            return rows != null ? rows : List.of();
        } catch (RuntimeException e) {
            log.warn("Backlog fetch failed, starting empty",
                    Map.of("sessionId", id, "error", String.valueOf(e.getMessage())));
            return List.of();
        }
    }

    private void cancelBackfillLocked() {
        backfillGeneration++;
        if (backfillTimer != null) {
            backfillTimer.cancel();
            backfillTimer = null;
        }
    }

    private void backfill(String id, long gen) {
        synchronized (lock) {
            if (gen != backfillGeneration) {
                return;
            }
        }
        List<ActivityLogEntry> rows = fetchBacklogSafely(id);
        synchronized (lock) {
            // cancelled while the fetch was running
            if (gen != backfillGeneration) {
                return;
            }
            backfillTimer = null;
            int added = buffer.merge(rows);
            if (added > 0) {
                log.info("Backfilled missed activity", Map.of("sessionId", id, "added", added));
                notifyListeners();
            }
        }
    }

    private class Listener implements ConnectionListener {

        @Override
        public void onEntry(ActivityLogEntry entry) {
            if (entry == null || entry.getId() == null) {
                log.warn("Dropping pushed entry without id");
                return;
            }
            if (buffer.append(entry)) {
                notifyListeners();
            }
        }

        @Override
        public void onStatusChange(ConnectionStatus previous, ConnectionStatus current) {
            notifyListeners();
        }

        @Override
        public void onResumed() {
            if (!policy.backfillOnReconnect() || sessionId == null) {
                return;
            }
            String id = sessionId;
            cancelBackfillLocked();
            long gen = backfillGeneration;
            backfillTimer = timers.schedule(() -> backfill(id, gen), 0, "activity-backfill");
        }
    }
}
