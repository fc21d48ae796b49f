package com.github.dimitryivaniuta.keyguard.lifecycle;

/**
 * A concurrent update won the compare-and-swap on a key record, or the key was already rotated.
 */
public class KeyConflictException extends RuntimeException {

    public KeyConflictException(String message) {
        super(message);
    }
}
