package com.github.dimitryivaniuta.keyguard.decision;

import java.time.Instant;
import java.util.Objects;

/**
 * Request facts the caller hands to {@link AccessDecisionService#decide}.
 *
 * @param userId optional authenticated user; when absent the key owner is used for per-user rules
 */
public record DecisionContext(String ip, String endpoint, String userId, Instant now) {

    public DecisionContext {
        Objects.requireNonNull(now, "now must not be null");
    }

    public static DecisionContext of(String ip, String endpoint, Instant now) {
        return new DecisionContext(ip, endpoint, null, now);
    }
}
