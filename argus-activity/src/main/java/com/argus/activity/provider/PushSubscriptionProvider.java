package com.argus.activity.provider;

import com.argus.activity.model.ActivityLogEntry;

import java.util.function.Consumer;

/**
 * Server-pushed event channel.
 * <p>
 * Callbacks may fire on any thread, including synchronously from within
 * {@link #subscribe}. Implementations deliver events of one topic in the order
 * they were produced.
 */
public interface PushSubscriptionProvider {

    String TOPIC_PREFIX = "activity-";

    /**
     * Open a subscription on {@code topic}.
     *
     * @param onEvent  receives each pushed entry
     * @param onStatus receives channel status signals
     * @return handle owned by the caller until passed to {@link #unsubscribe}
     */
    SubscriptionHandle subscribe(String topic,
                                 Consumer<ActivityLogEntry> onEvent,
                                 Consumer<SubscriptionStatus> onStatus);

    /**
     * Release a subscription. No callbacks for the handle fire afterwards.
     */
    void unsubscribe(SubscriptionHandle handle);

    /**
     * Topic carrying the activity of one live session.
     */
    static String topicFor(String sessionId) {
        return TOPIC_PREFIX + sessionId;
    }
}
