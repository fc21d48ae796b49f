package com.github.dimitryivaniuta.keyguard.store;

/**
 * Infrastructure failure of a key or counter store. Retryable by the client; never treated as an allow.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
