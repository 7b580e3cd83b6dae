package com.argus.activity.provider;

import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.model.LiveSession;
import com.argus.activity.model.SessionUpdate;

/**
 * Write path for live sessions and their activity.
 * Every method throws {@link ActivityWriteException} when the write fails.
 */
public interface ActivityWriteProvider {

    /**
     * Persist a new session; the given record has no id yet.
     *
     * @return the stored session with its assigned id
     */
    LiveSession createSession(LiveSession session);

    /**
     * @return the session after the update
     */
    LiveSession updateSession(String sessionId, SessionUpdate update);

    /**
     * Persist an entry; the given record has no id or timestamp yet.
     *
     * @return the stored entry
     */
    ActivityLogEntry appendActivity(ActivityLogEntry entry);
}
