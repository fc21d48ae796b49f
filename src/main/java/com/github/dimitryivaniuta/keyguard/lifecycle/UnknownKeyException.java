package com.github.dimitryivaniuta.keyguard.lifecycle;

public class UnknownKeyException extends RuntimeException {

    public UnknownKeyException(String keyId) {
        super("API key not found: " + keyId);
    }
}
