package com.argus.app.web;

import com.argus.activity.stream.ActivityStreamController;
import com.argus.activity.stream.StreamSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Moves snapshots from a controller to one slow consumer off the controller's
 * thread.
 * <p>
 * {@link #accept} only records the newest snapshot and returns. A send task on
 * the executor writes it to the sink; snapshots that arrive while a write is in
 * progress replace each other, so the sink always catches up to the latest
 * state. At most one send task per relay runs at a time.
 */
@Slf4j
class SnapshotRelay implements Consumer<StreamSnapshot>, AutoCloseable {

    @FunctionalInterface
    interface Sink {
        void send(StreamSnapshot snapshot) throws IOException;
    }

    private final Sink sink;
    private final Executor executor;
    private final AtomicReference<StreamSnapshot> pending = new AtomicReference<>();
    private final AtomicBoolean sending = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<Runnable> unregister = new AtomicReference<>();

    SnapshotRelay(Sink sink, Executor executor) {
        this.sink = sink;
        this.executor = executor;
    }

    /**
     * Register with the controller and queue its current snapshot.
     * If the relay was closed in the meantime the registration is undone at once.
     */
    void attach(ActivityStreamController controller) {
        Runnable remove = controller.addSnapshotListener(this);
        unregister.set(remove);
        if (closed.get()) {
            remove.run();
            return;
        }
        accept(controller.getSnapshot());
    }

    @Override
    public void accept(StreamSnapshot snapshot) {
        if (closed.get()) {
            return;
        }
        pending.set(snapshot);
        scheduleSend();
    }

    boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        pending.set(null);
        Runnable remove = unregister.get();
        if (remove != null) {
            remove.run();
        }
    }

    private void scheduleSend() {
        if (!sending.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            sending.set(false);
            log.debug("Snapshot send rejected: {}", e.getMessage());
            close();
        }
    }

    private void drain() {
        try {
            StreamSnapshot next;
            while (!closed.get() && (next = pending.getAndSet(null)) != null) {
                sink.send(next);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Snapshot send failed: {}", e.getMessage());
            close();
        } finally {
            sending.set(false);
        }
        // a snapshot may have landed after the loop saw an empty slot
        if (!closed.get() && pending.get() != null) {
            scheduleSend();
        }
    }
}
