package com.argus.activity.provider;

import com.argus.activity.model.ActivityLogEntry;

import java.util.List;

/**
 * Historical fetch of activity persisted before a viewer subscribed.
 */
@FunctionalInterface
public interface BacklogProvider {

    /**
     * @return entries of the session in ascending {@code createdAt} order
     * @throws ActivityProviderException when the backlog cannot be read
     */
    List<ActivityLogEntry> fetchBacklog(String sessionId);
}
