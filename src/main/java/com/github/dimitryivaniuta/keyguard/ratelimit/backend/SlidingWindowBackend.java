package com.github.dimitryivaniuta.keyguard.ratelimit.backend;

import com.github.dimitryivaniuta.keyguard.ratelimit.ConsumeResult;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.store.CounterState;
import com.github.dimitryivaniuta.keyguard.store.CounterStore;

import java.time.Instant;

/**
 * Two-window approximation of a sliding log.
 *
 * <p>effective = current + previous * (1 - elapsed fraction of the current window). The previous window's
 * weight decays linearly, so the effective count is continuous across a rollover for a steady request rate.
 * It assumes requests in the previous window were evenly spread.
 */
public final class SlidingWindowBackend extends AbstractCounterBackend {

    /** The current count still weighs on the next window, so a state matters until that one ends. */
    record State(long windowStartMillis, long currentCount, long previousCount, boolean granted, long retentionMillis)
            implements CounterState {

        static State of(long windowStartMillis, long currentCount, long previousCount, boolean granted,
                        long windowMs, long nowMs) {
            return new State(windowStartMillis, currentCount, previousCount, granted,
                    windowStartMillis + 2 * windowMs - nowMs);
        }

        /** State shifted to the window starting at {@code start}. */
        State rollTo(long start, long windowMs, long nowMs) {
            if (windowStartMillis >= start) return this;
            if (windowStartMillis == start - windowMs) return of(start, 0, currentCount, granted, windowMs, nowMs);
            return of(start, 0, 0, granted, windowMs, nowMs);
        }

        double effectiveCount(long nowMs, long windowMs) {
            double elapsed = Math.min(1.0d, Math.max(0.0d, (nowMs - windowStartMillis) / (double) windowMs));
            return currentCount + previousCount * (1.0d - elapsed);
        }
    }

    public SlidingWindowBackend(CounterStore store) {
        super(store);
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.SLIDING_WINDOW;
    }

    @Override
    public ConsumeResult tryConsume(String scopeKey, RateLimitRule rule, Instant now) {
        requireAlgorithm(rule);
        long nowMs = now.toEpochMilli();
        long windowMs = rule.windowSeconds() * 1000L;
        long start = windowStart(nowMs, windowMs);
        int capacity = rule.capacity();

        State state = store.atomicUpdate(scopeKey, State.class, current -> {
            State rolled = (current == null)
                    ? State.of(start, 0, 0, false, windowMs, nowMs)
                    : current.rollTo(start, windowMs, nowMs);
            if (rolled.effectiveCount(nowMs, windowMs) < capacity) {
                return State.of(rolled.windowStartMillis(), rolled.currentCount() + 1, rolled.previousCount(), true,
                        windowMs, nowMs);
            }
            return State.of(rolled.windowStartMillis(), rolled.currentCount(), rolled.previousCount(), false,
                    windowMs, nowMs);
        });

        return toResult(state, rule, nowMs, windowMs, state.granted());
    }

    @Override
    public ConsumeResult peek(String scopeKey, RateLimitRule rule, Instant now) {
        requireAlgorithm(rule);
        long nowMs = now.toEpochMilli();
        long windowMs = rule.windowSeconds() * 1000L;
        long start = windowStart(nowMs, windowMs);
        State state = store.peek(scopeKey, State.class)
                .map(s -> s.rollTo(start, windowMs, nowMs))
                .orElseGet(() -> State.of(start, 0, 0, false, windowMs, nowMs));
        boolean wouldPass = state.effectiveCount(nowMs, windowMs) < rule.capacity();
        return toResult(state, rule, nowMs, windowMs, wouldPass);
    }

    private static ConsumeResult toResult(State state, RateLimitRule rule, long nowMs, long windowMs, boolean allowed) {
        int capacity = rule.capacity();
        double effective = state.effectiveCount(nowMs, windowMs);
        long remaining = (long) Math.floor(capacity - effective);
        Instant resetAt = Instant.ofEpochMilli(state.windowStartMillis() + windowMs);
        if (allowed) {
            return ConsumeResult.allowed(capacity, remaining, resetAt);
        }
        return ConsumeResult.denied(capacity, remaining, resetAt, retryAfterSeconds(state, capacity, nowMs, windowMs));
    }

    /** Time until the weighted count drops below capacity. */
    private static long retryAfterSeconds(State state, int capacity, long nowMs, long windowMs) {
        long windowEnd = state.windowStartMillis() + windowMs;
        long current = state.currentCount();
        long previous = state.previousCount();
        long passAt;
        if (current < capacity && previous > 0) {
            // previous * (1 - f) < capacity - current
            double fraction = 1.0d - (capacity - current) / (double) previous;
            passAt = state.windowStartMillis() + (long) Math.ceil(fraction * windowMs) + 1;
        } else {
            // next window: current becomes previous and must decay below capacity
            double fraction = current == 0 ? 0.0d : Math.max(0.0d, 1.0d - capacity / (double) current);
            passAt = windowEnd + (long) Math.ceil(fraction * windowMs) + 1;
        }
        return ceilSeconds(passAt - nowMs);
    }
}
