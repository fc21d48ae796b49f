package com.github.dimitryivaniuta.keyguard.ratelimit.backend;

import com.github.dimitryivaniuta.keyguard.ratelimit.ConsumeResult;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.store.CounterState;
import com.github.dimitryivaniuta.keyguard.store.CounterStore;

import java.time.Instant;

/**
 * Contiguous windows aligned to the epoch.
 *
 * <p>Up to {@code 2 x capacity} requests can pass around a window boundary (end of one window plus start of
 * the next). That is the accepted cost of this algorithm; use the sliding window where it matters.
 */
public final class FixedWindowBackend extends AbstractCounterBackend {

    /** {@code granted} reports the outcome of the update that produced this state. */
    record State(long windowStartMillis, long count, boolean granted, long retentionMillis) implements CounterState {

        static State of(long windowStartMillis, long count, boolean granted, long windowMs, long nowMs) {
            return new State(windowStartMillis, count, granted, windowStartMillis + windowMs - nowMs);
        }
    }

    public FixedWindowBackend(CounterStore store) {
        super(store);
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.FIXED_WINDOW;
    }

    @Override
    public ConsumeResult tryConsume(String scopeKey, RateLimitRule rule, Instant now) {
        requireAlgorithm(rule);
        long nowMs = now.toEpochMilli();
        long windowMs = rule.windowSeconds() * 1000L;
        long start = windowStart(nowMs, windowMs);
        int capacity = rule.capacity();

        State state = store.atomicUpdate(scopeKey, State.class, current -> {
            long effectiveStart = start;
            long count = 0;
            if (current != null && current.windowStartMillis() >= start) {
                // same window, or a request carrying an older timestamp than the stored window
                effectiveStart = current.windowStartMillis();
                count = current.count();
            }
            if (count < capacity) {
                return State.of(effectiveStart, count + 1, true, windowMs, nowMs);
            }
            return State.of(effectiveStart, count, false, windowMs, nowMs);
        });

        Instant resetAt = Instant.ofEpochMilli(state.windowStartMillis() + windowMs);
        long remaining = capacity - state.count();
        if (state.granted()) {
            return ConsumeResult.allowed(capacity, remaining, resetAt);
        }
        return ConsumeResult.denied(capacity, remaining, resetAt, ceilSeconds(resetAt.toEpochMilli() - nowMs));
    }

    @Override
    public ConsumeResult peek(String scopeKey, RateLimitRule rule, Instant now) {
        requireAlgorithm(rule);
        long nowMs = now.toEpochMilli();
        long windowMs = rule.windowSeconds() * 1000L;
        long start = windowStart(nowMs, windowMs);
        long count = store.peek(scopeKey, State.class)
                .filter(s -> s.windowStartMillis() >= start)
                .map(State::count)
                .orElse(0L);
        Instant resetAt = Instant.ofEpochMilli(start + windowMs);
        long remaining = rule.capacity() - count;
        if (remaining > 0) {
            return ConsumeResult.allowed(rule.capacity(), remaining, resetAt);
        }
        return ConsumeResult.denied(rule.capacity(), 0, resetAt, ceilSeconds(resetAt.toEpochMilli() - nowMs));
    }
}
