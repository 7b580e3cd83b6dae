package com.argus.activity.provider;

/**
 * A session or activity mutation failed.
 * <p>
 * Kept distinct from connectivity problems, which never surface as exceptions:
 * the remedy here is to retry the mutation, not to wait for a reconnect.
 */
public class ActivityWriteException extends ActivityProviderException {

    private final String operation;

    public ActivityWriteException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public ActivityWriteException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    /** Name of the write that failed, e.g. {@code appendActivity}. */
    public String getOperation() {
        return operation;
    }
}
