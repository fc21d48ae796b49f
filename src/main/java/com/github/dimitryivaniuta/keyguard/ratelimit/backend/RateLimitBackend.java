package com.github.dimitryivaniuta.keyguard.ratelimit.backend;

import com.github.dimitryivaniuta.keyguard.ratelimit.ConsumeResult;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;

import java.time.Instant;

/**
 * Scope-agnostic implementation of one algorithm.
 *
 * <p>{@code scopeKey} is the composite {@code scope:identifier:rule} key; backends never interpret it.
 * Implementations must be safe for concurrent calls on the same key.
 */
public interface RateLimitBackend {

    RateLimitAlgorithm algorithm();

    /** Consumes one unit if the rule allows it. */
    ConsumeResult tryConsume(String scopeKey, RateLimitRule rule, Instant now);

    /** Current status without consuming. {@code allowed} tells whether the next call would pass. */
    ConsumeResult peek(String scopeKey, RateLimitRule rule, Instant now);

    /** Drops the counter state; the next call starts fresh. */
    void reset(String scopeKey);
}
