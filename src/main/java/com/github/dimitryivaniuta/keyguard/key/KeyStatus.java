package com.github.dimitryivaniuta.keyguard.key;

/**
 * Stored state of an API key. REVOKED and EXPIRED are terminal; ACTIVE and INACTIVE toggle.
 */
public enum KeyStatus {
    ACTIVE,
    INACTIVE,
    REVOKED,
    EXPIRED;

    public boolean isTerminal() {
        return this == REVOKED || this == EXPIRED;
    }

    public boolean canTransitionTo(KeyStatus target) {
        return target == this || !isTerminal();
    }
}
