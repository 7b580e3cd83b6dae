package com.argus.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskTimers} backed by a single daemon {@link ScheduledExecutorService}.
 * Task failures are logged and never kill the scheduler thread.
 */
@Slf4j
public class ScheduledTimers implements TaskTimers, AutoCloseable {

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final ScheduledExecutorService scheduler;

    public ScheduledTimers() {
        this("argus-timers-" + POOL_SEQ.incrementAndGet());
    }

    public ScheduledTimers(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Timer schedule(Runnable task, long delayMs, String name) {
        FutureTimer timer = new FutureTimer();
        timer.future = scheduler.schedule(() -> timer.runGuarded(task, name),
                Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        return timer;
    }

    @Override
    public Timer scheduleRepeating(Runnable task, long periodMs, String name) {
        long period = Math.max(1, periodMs);
        FutureTimer timer = new FutureTimer();
        timer.future = scheduler.scheduleAtFixedRate(() -> timer.runGuarded(task, name),
                period, period, TimeUnit.MILLISECONDS);
        return timer;
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    private static final class FutureTimer implements Timer {

        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        void runGuarded(Runnable task, String name) {
            if (cancelled.get()) {
                return;
            }
            try {
                task.run();
            } catch (Exception e) {
                log.error("Timer task '{}' failed: {}", name, e.getMessage(), e);
            }
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                ScheduledFuture<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
