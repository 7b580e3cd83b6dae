package com.argus.activity.provider;

/**
 * Status signals a push channel reports for one subscription.
 */
public enum SubscriptionStatus {
    /** The subscription is live. */
    SUBSCRIBED,
    /** The channel failed. */
    CHANNEL_ERROR,
    /** The subscribe handshake or the channel timed out. */
    TIMED_OUT,
    /** The peer closed the channel deliberately. */
    CLOSED
}
