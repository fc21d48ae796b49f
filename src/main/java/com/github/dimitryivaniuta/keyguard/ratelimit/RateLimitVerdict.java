package com.github.dimitryivaniuta.keyguard.ratelimit;

import java.time.Instant;

/**
 * Aggregated outcome of all applicable rules.
 *
 * <p>On denial the diagnostics describe the rule that denied; on success they describe the most constrained
 * rule (lowest remaining). {@code limitingRule} is for internal logging only.
 */
public record RateLimitVerdict(
        boolean allowed,
        RateLimitRule limitingRule,
        Long limit,
        Long remaining,
        Instant resetAt,
        Long retryAfterSeconds,
        RateLimitAlgorithm algorithm
) {

    /** No rule applied. */
    public static RateLimitVerdict unlimited() {
        return new RateLimitVerdict(true, null, null, null, null, null, null);
    }

    public static RateLimitVerdict of(RateLimitRule rule, ConsumeResult result) {
        return new RateLimitVerdict(
                result.allowed(),
                rule,
                result.limit(),
                result.remaining(),
                result.resetAt(),
                result.allowed() ? null : result.retryAfterSeconds(),
                rule.algorithm());
    }
}
