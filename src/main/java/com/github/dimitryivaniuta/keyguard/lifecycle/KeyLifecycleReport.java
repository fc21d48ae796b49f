package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.KeyStatus;

import java.time.Instant;
import java.util.List;

public record KeyLifecycleReport(
        String keyId,
        LifecycleStatus lifecycleStatus,
        KeyStatus storedStatus,
        Instant createdAt,
        Instant expiresAt,
        Instant lastUsedAt,
        Long daysUntilExpiry,
        String replacedBy,
        String replaces,
        List<String> recommendations
) {
}
