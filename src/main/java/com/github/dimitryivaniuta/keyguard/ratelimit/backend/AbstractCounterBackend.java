package com.github.dimitryivaniuta.keyguard.ratelimit.backend;

import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.store.CounterStore;

import java.util.Objects;

/**
 * Common plumbing for backends whose state lives in a {@link CounterStore}.
 */
abstract class AbstractCounterBackend implements RateLimitBackend {

    protected final CounterStore store;

    protected AbstractCounterBackend(CounterStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public void reset(String scopeKey) {
        store.remove(scopeKey);
    }

    protected void requireAlgorithm(RateLimitRule rule) {
        if (rule.algorithm() != algorithm()) {
            throw new IllegalArgumentException(
                    "Rule " + rule.id() + " uses " + rule.algorithm() + ", backend handles " + algorithm());
        }
    }

    protected static long windowStart(long nowMillis, long windowMillis) {
        return Math.floorDiv(nowMillis, windowMillis) * windowMillis;
    }

    protected static long ceilSeconds(long millis) {
        if (millis <= 0) return 0L;
        return (millis + 999L) / 1000L;
    }
}
