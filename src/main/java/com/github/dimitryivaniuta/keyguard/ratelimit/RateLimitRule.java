package com.github.dimitryivaniuta.keyguard.ratelimit;

import java.util.Objects;

/**
 * One rate limit applied to one scope.
 *
 * <p>Window algorithms use {@code capacity} requests per {@code windowSeconds}. The token bucket uses
 * {@code capacity} as its burst capacity and refills at {@code refillRatePerSecond}. Invalid combinations are
 * rejected on construction, i.e. when configuration is loaded.
 *
 * @param progressive whether repeated violations escalate the penalty multiplier for this rule
 */
public record RateLimitRule(
        String id,
        RateLimitScope scope,
        RateLimitAlgorithm algorithm,
        int capacity,
        long windowSeconds,
        double refillRatePerSecond,
        boolean progressive
) {

    public RateLimitRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id must not be blank");
        }
        Objects.requireNonNull(scope, "scope must not be null (rule " + id + ")");
        Objects.requireNonNull(algorithm, "algorithm must not be null (rule " + id + ")");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0 (rule " + id + ")");
        }
        if (algorithm.isWindowed()) {
            if (windowSeconds <= 0) {
                throw new IllegalArgumentException("windowSeconds must be > 0 (rule " + id + ")");
            }
        } else if (!(refillRatePerSecond > 0) || Double.isInfinite(refillRatePerSecond)) {
            throw new IllegalArgumentException("refillRatePerSecond must be > 0 (rule " + id + ")");
        }
    }

    public static RateLimitRule fixedWindow(String id, RateLimitScope scope, int capacity, long windowSeconds) {
        return new RateLimitRule(id, scope, RateLimitAlgorithm.FIXED_WINDOW, capacity, windowSeconds, 0d, false);
    }

    public static RateLimitRule slidingWindow(String id, RateLimitScope scope, int capacity, long windowSeconds) {
        return new RateLimitRule(id, scope, RateLimitAlgorithm.SLIDING_WINDOW, capacity, windowSeconds, 0d, false);
    }

    public static RateLimitRule tokenBucket(String id, RateLimitScope scope, int burstCapacity, double refillRatePerSecond) {
        return new RateLimitRule(id, scope, RateLimitAlgorithm.TOKEN_BUCKET, burstCapacity, 0L, refillRatePerSecond, false);
    }

    public int burstCapacity() {
        return capacity;
    }

    public RateLimitRule asProgressive() {
        return new RateLimitRule(id, scope, algorithm, capacity, windowSeconds, refillRatePerSecond, true);
    }

    public RateLimitRule withCapacity(int newCapacity) {
        return new RateLimitRule(id, scope, algorithm, newCapacity, windowSeconds, refillRatePerSecond, progressive);
    }

    /**
     * Rule as seen by a penalized client: window capacity shrinks by {@code multiplier} (never below one request),
     * refill slows by it. Windows keep their length so they stay aligned with the unpenalized counters.
     */
    public RateLimitRule penalized(double multiplier) {
        if (!(multiplier > 1.0d)) {
            return this;
        }
        if (algorithm.isWindowed()) {
            int reduced = Math.max(1, (int) Math.floor(capacity / multiplier));
            return new RateLimitRule(id, scope, algorithm, reduced, windowSeconds, refillRatePerSecond, progressive);
        }
        return new RateLimitRule(id, scope, algorithm, capacity, windowSeconds, refillRatePerSecond / multiplier, progressive);
    }
}
