package com.github.dimitryivaniuta.keyguard.ratelimit.backend;

import com.github.dimitryivaniuta.keyguard.ratelimit.ConsumeResult;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.store.CounterState;
import com.github.dimitryivaniuta.keyguard.store.CounterStore;

import java.time.Instant;

/**
 * Token bucket: absorbs bursts up to the burst capacity, then admits {@code refillRatePerSecond} on average.
 * New buckets start full. Tokens never exceed the burst capacity.
 */
public final class TokenBucketBackend extends AbstractCounterBackend {

    /** Kept until the bucket would be full again; a full bucket is the same as no state. */
    record State(double tokens, long lastRefillMillis, boolean granted, long retentionMillis) implements CounterState {

        static State of(double tokens, long lastRefillMillis, boolean granted, double ratePerSecond, int capacity) {
            long toFull = (long) Math.ceil(Math.max(0.0d, capacity - tokens) / ratePerSecond * 1000.0d);
            return new State(tokens, lastRefillMillis, granted, toFull);
        }

        State refill(long nowMs, double ratePerSecond, int capacity) {
            if (nowMs <= lastRefillMillis) return this;
            double refilled = Math.min(capacity, tokens + (nowMs - lastRefillMillis) / 1000.0d * ratePerSecond);
            return of(refilled, nowMs, granted, ratePerSecond, capacity);
        }
    }

    public TokenBucketBackend(CounterStore store) {
        super(store);
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.TOKEN_BUCKET;
    }

    @Override
    public ConsumeResult tryConsume(String scopeKey, RateLimitRule rule, Instant now) {
        requireAlgorithm(rule);
        long nowMs = now.toEpochMilli();
        int capacity = rule.burstCapacity();
        double rate = rule.refillRatePerSecond();

        State state = store.atomicUpdate(scopeKey, State.class, current -> {
            State refilled = (current == null)
                    ? State.of(capacity, nowMs, false, rate, capacity)
                    : current.refill(nowMs, rate, capacity);
            double tokens = Math.min(refilled.tokens(), capacity);
            if (tokens >= 1.0d) {
                return State.of(tokens - 1.0d, refilled.lastRefillMillis(), true, rate, capacity);
            }
            return State.of(tokens, refilled.lastRefillMillis(), false, rate, capacity);
        });

        return toResult(state, capacity, rate, nowMs, state.granted());
    }

    @Override
    public ConsumeResult peek(String scopeKey, RateLimitRule rule, Instant now) {
        requireAlgorithm(rule);
        long nowMs = now.toEpochMilli();
        int capacity = rule.burstCapacity();
        double rate = rule.refillRatePerSecond();
        State state = store.peek(scopeKey, State.class)
                .map(s -> s.refill(nowMs, rate, capacity))
                .orElseGet(() -> State.of(capacity, nowMs, false, rate, capacity));
        return toResult(state, capacity, rate, nowMs, state.tokens() >= 1.0d);
    }

    private static ConsumeResult toResult(State state, int capacity, double rate, long nowMs, boolean allowed) {
        double tokens = state.tokens();
        long remaining = (long) Math.floor(tokens);
        long millisToFull = (long) Math.ceil((capacity - tokens) / rate * 1000.0d);
        Instant resetAt = Instant.ofEpochMilli(nowMs + Math.max(0L, millisToFull));
        if (allowed) {
            return ConsumeResult.allowed(capacity, remaining, resetAt);
        }
        long millisToNextToken = (long) Math.ceil((1.0d - tokens) / rate * 1000.0d);
        return ConsumeResult.denied(capacity, remaining, resetAt, ceilSeconds(millisToNextToken));
    }
}
