package com.argus.activity.stream;

import com.argus.activity.model.ActivityLogEntry;

/**
 * Receives what a {@link ConnectionStateMachine} observes.
 * Invoked while the machine's lock is held; implementations must not block.
 */
public interface ConnectionListener {

    /** A pushed entry arrived on the current subscription. */
    void onEntry(ActivityLogEntry entry);

    void onStatusChange(ConnectionStatus previous, ConnectionStatus current);

    /**
     * The subscription is live again after a failure or a manual reconnect;
     * pushes produced in between may have been missed.
     */
    default void onResumed() {
    }
}
