package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Pure state checks on a key record. EXPIRED is derived from {@code expiresAt} at check time, so no
 * background job has to run for a key to stop working.
 */
public class KeyLifecycle {

    private final IpAllowListMatcher ipMatcher;
    private final Duration expiringSoon;

    public KeyLifecycle(IpAllowListMatcher ipMatcher, Duration expiringSoon) {
        this.ipMatcher = Objects.requireNonNull(ipMatcher, "ipMatcher must not be null");
        this.expiringSoon = Objects.requireNonNull(expiringSoon, "expiringSoon must not be null");
    }

    public LifecycleVerdict check(ApiKeyRecord record, Instant now, String presentedIp) {
        if (record.getStatus() == KeyStatus.REVOKED) {
            return LifecycleVerdict.denied(LifecycleDenial.REVOKED);
        }
        if (record.getStatus() == KeyStatus.INACTIVE) {
            return LifecycleVerdict.denied(LifecycleDenial.INACTIVE);
        }
        if (record.isExpiredAt(now)) {
            return LifecycleVerdict.denied(LifecycleDenial.EXPIRED);
        }
        if (!ipMatcher.isAllowed(record.getIpAllowList(), presentedIp)) {
            return LifecycleVerdict.denied(LifecycleDenial.IP_RESTRICTED);
        }
        return LifecycleVerdict.allow();
    }

    /** Stored status with expiry applied. */
    public KeyStatus effectiveStatus(ApiKeyRecord record, Instant now) {
        if (record.getStatus().isTerminal()) {
            return record.getStatus();
        }
        return record.isExpiredAt(now) ? KeyStatus.EXPIRED : record.getStatus();
    }

    public LifecycleStatus lifecycleStatus(ApiKeyRecord record, Instant now) {
        return switch (effectiveStatus(record, now)) {
            case REVOKED -> LifecycleStatus.REVOKED;
            case EXPIRED -> LifecycleStatus.EXPIRED;
            case INACTIVE -> LifecycleStatus.INACTIVE;
            case ACTIVE -> {
                if (record.isRotated()) {
                    yield LifecycleStatus.ROTATING;
                }
                if (record.getExpiresAt() != null && !record.getExpiresAt().isAfter(now.plus(expiringSoon))) {
                    yield LifecycleStatus.EXPIRING_SOON;
                }
                yield LifecycleStatus.ACTIVE;
            }
        };
    }

    public IpAllowListMatcher ipMatcher() {
        return ipMatcher;
    }
}
