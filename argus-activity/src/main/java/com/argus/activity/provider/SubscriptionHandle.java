package com.argus.activity.provider;

/**
 * Opaque handle for one live subscription; passed back to
 * {@link PushSubscriptionProvider#unsubscribe(SubscriptionHandle)}.
 */
public interface SubscriptionHandle {

    String topic();
}
