package com.github.dimitryivaniuta.keyguard.lifecycle;

public class IllegalKeyTransitionException extends RuntimeException {

    public IllegalKeyTransitionException(String keyId, String message) {
        super("API key " + keyId + ": " + message);
    }
}
