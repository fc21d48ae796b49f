package com.github.dimitryivaniuta.keyguard.lifecycle;

import java.time.Duration;

/**
 * Why a key is rotated. Supplies the default overlap during which the old key keeps working.
 */
public enum RotationTrigger {
    MANUAL(Duration.ofDays(14), false),
    SCHEDULED(Duration.ofDays(14), false),
    COMPLIANCE_REQUIREMENT(Duration.ofDays(30), false),
    EXPIRATION_APPROACHING(Duration.ofDays(30), false),
    /** Old key is revoked at once; no grace period. */
    SECURITY_INCIDENT(Duration.ZERO, true);

    private final Duration defaultGracePeriod;
    private final boolean immediateRevocation;

    RotationTrigger(Duration defaultGracePeriod, boolean immediateRevocation) {
        this.defaultGracePeriod = defaultGracePeriod;
        this.immediateRevocation = immediateRevocation;
    }

    public Duration defaultGracePeriod() { return defaultGracePeriod; }

    public boolean immediateRevocation() { return immediateRevocation; }
}
