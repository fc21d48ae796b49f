package com.github.dimitryivaniuta.keyguard.ratelimit;

import java.time.Instant;

/**
 * Outcome of one backend check.
 *
 * @param limit capacity of the rule that produced this result
 * @param remaining requests still admissible right now (never negative)
 * @param resetAt end of the current window, or the instant a bucket is full again
 * @param retryAfterSeconds seconds until a retry can succeed; 0 when allowed
 */
public record ConsumeResult(
        boolean allowed,
        long limit,
        long remaining,
        Instant resetAt,
        long retryAfterSeconds
) {

    public static ConsumeResult allowed(long limit, long remaining, Instant resetAt) {
        return new ConsumeResult(true, limit, Math.max(0, remaining), resetAt, 0L);
    }

    public static ConsumeResult denied(long limit, long remaining, Instant resetAt, long retryAfterSeconds) {
        return new ConsumeResult(false, limit, Math.max(0, remaining), resetAt, Math.max(1L, retryAfterSeconds));
    }
}
