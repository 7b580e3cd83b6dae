package com.argus.activity.provider;

/**
 * Failure reported by an activity provider.
 */
public class ActivityProviderException extends RuntimeException {

    public ActivityProviderException(String message) {
        super(message);
    }

    public ActivityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
