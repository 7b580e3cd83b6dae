package com.argus.activity.provider;

import com.argus.activity.model.LiveSession;

import java.util.List;

/**
 * Read access to live sessions of a project.
 */
public interface LiveSessionQuery {

    /**
     * @return sessions with status {@code active}, most recently started first
     */
    List<LiveSession> listActiveSessions(String projectId);
}
