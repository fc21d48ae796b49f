package com.github.dimitryivaniuta.keyguard.decision;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitVerdict;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of {@link AccessDecisionService#decide}. Denials carry a {@link DenyReason}; rate limit
 * diagnostics are present whenever at least one rule was evaluated.
 */
public record Decision(
        boolean allowed,
        DenyReason denyReason,
        Long retryAfterSeconds,
        Long remaining,
        Long limit,
        Instant resetAt,
        RateLimitAlgorithm algorithm,
        ApiKeyRecord keyRecord
) {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_ALGORITHM = "X-RateLimit-Algorithm";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    public static Decision allow(ApiKeyRecord record, RateLimitVerdict verdict) {
        return new Decision(true, null, null,
                verdict.remaining(), verdict.limit(), verdict.resetAt(), verdict.algorithm(), record);
    }

    /** Store failure with fail-open enabled. */
    public static Decision allowUnchecked(ApiKeyRecord record) {
        return new Decision(true, null, null, null, null, null, null, record);
    }

    public static Decision deny(DenyReason reason) {
        return new Decision(false, reason, null, null, null, null, null, null);
    }

    public static Decision rateLimited(RateLimitVerdict verdict) {
        return new Decision(false, DenyReason.RATE_LIMITED, verdict.retryAfterSeconds(),
                verdict.remaining(), verdict.limit(), verdict.resetAt(), verdict.algorithm(), null);
    }

    /** Client-facing reason code, {@code null} when allowed. */
    public String reason() {
        return denyReason == null ? null : denyReason.code();
    }

    public int httpStatus() {
        return denyReason == null ? 200 : denyReason.httpStatus();
    }

    /** Response headers to surface to the client, in a stable order. */
    public Map<String, String> headers() {
        Map<String, String> h = new LinkedHashMap<>();
        if (limit != null) h.put(HEADER_LIMIT, String.valueOf(limit));
        if (remaining != null) h.put(HEADER_REMAINING, String.valueOf(Math.max(0, remaining)));
        if (resetAt != null) h.put(HEADER_RESET, String.valueOf(resetAt.getEpochSecond()));
        if (algorithm != null) h.put(HEADER_ALGORITHM, algorithm.headerValue());
        if (retryAfterSeconds != null) h.put(HEADER_RETRY_AFTER, String.valueOf(Math.max(1, retryAfterSeconds)));
        return Collections.unmodifiableMap(h);
    }
}
