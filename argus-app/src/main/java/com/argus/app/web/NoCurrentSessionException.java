package com.argus.app.web;

/**
 * A call needed the project's current live session but none is open.
 */
public class NoCurrentSessionException extends RuntimeException {

    public NoCurrentSessionException(String projectId) {
        super("No current live session for project " + projectId);
    }
}
