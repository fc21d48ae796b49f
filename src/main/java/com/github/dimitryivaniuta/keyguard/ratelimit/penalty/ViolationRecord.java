package com.github.dimitryivaniuta.keyguard.ratelimit.penalty;

import java.time.Instant;

public record ViolationRecord(
        String identifier,
        int consecutiveViolations,
        double penaltyMultiplier,
        Instant lastViolationAt
) {

    public static final double BASELINE = 1.0d;

    boolean cooledDown(Instant now, PenaltyPolicy policy) {
        return !now.isBefore(lastViolationAt.plus(policy.cooldown()));
    }

    boolean withinWindow(Instant now, PenaltyPolicy policy) {
        return !now.isAfter(lastViolationAt.plus(policy.window()));
    }
}
