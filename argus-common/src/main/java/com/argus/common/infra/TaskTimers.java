package com.argus.common.infra;

/**
 * Schedules cancellable one-shot and repeating tasks.
 * <p>
 * Owners keep the returned {@link Timer} handles and cancel them on teardown;
 * a cancelled task never runs afterwards.
 */
public interface TaskTimers {

    /**
     * Run {@code task} once after {@code delayMs}.
     */
    Timer schedule(Runnable task, long delayMs, String name);

    /**
     * Run {@code task} every {@code periodMs}, first run after one period.
     */
    Timer scheduleRepeating(Runnable task, long periodMs, String name);

    /**
     * Handle to a scheduled task.
     */
    interface Timer {

        /** Cancel the task; idempotent. */
        void cancel();

        boolean isCancelled();
    }
}
