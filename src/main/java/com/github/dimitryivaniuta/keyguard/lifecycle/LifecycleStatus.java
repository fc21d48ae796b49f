package com.github.dimitryivaniuta.keyguard.lifecycle;

/**
 * Reporting view of a key, derived from the stored status, expiry and rotation links.
 */
public enum LifecycleStatus {
    ACTIVE,
    EXPIRING_SOON,
    /** Rotated; still valid until its grace period ends. */
    ROTATING,
    INACTIVE,
    EXPIRED,
    REVOKED
}
