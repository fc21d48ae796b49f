package com.github.dimitryivaniuta.keyguard.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * In-process counter store on a Caffeine cache.
 *
 * <p>Updates go through {@code asMap().compute}, which locks only the entry being computed, so hot keys
 * (the global scope, a busy API key) do not block unrelated keys. Each entry lives for its state's
 * {@link CounterState#retentionMillis() retention}, never less than {@code minimumTtl}; reads do not extend it.
 */
@Slf4j
public final class CaffeineCounterStore implements CounterStore, AutoCloseable {

    private final Cache<String, CounterState> cache;

    public CaffeineCounterStore(Duration minimumTtl, long maximumSize) {
        this(minimumTtl, maximumSize, Ticker.systemTicker());
    }

    CaffeineCounterStore(Duration minimumTtl, long maximumSize, Ticker ticker) {
        Objects.requireNonNull(minimumTtl, "minimumTtl must not be null");
        if (minimumTtl.isNegative()) {
            throw new IllegalArgumentException("minimumTtl must not be negative");
        }
        this.cache = Caffeine.newBuilder()
                .expireAfter(new RetentionExpiry(minimumTtl.toNanos()))
                .maximumSize(maximumSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public <S extends CounterState> S atomicUpdate(String compositeKey, Class<S> type, UnaryOperator<S> updateFn) {
        Objects.requireNonNull(compositeKey, "compositeKey must not be null");
        Objects.requireNonNull(type, "type must not be null");
        try {
            return type.cast(cache.asMap().compute(compositeKey, (k, current) -> updateFn.apply(type.cast(current))));
        } catch (ClassCastException ex) {
            throw new IllegalStateException("Counter state type mismatch for key " + compositeKey, ex);
        }
    }

    @Override
    public <S extends CounterState> Optional<S> peek(String compositeKey, Class<S> type) {
        CounterState state = cache.getIfPresent(compositeKey);
        if (state == null) {
            return Optional.empty();
        }
        if (!type.isInstance(state)) {
            throw new IllegalStateException("Counter state type mismatch for key " + compositeKey);
        }
        return Optional.of(type.cast(state));
    }

    @Override
    public void remove(String compositeKey) {
        cache.invalidate(compositeKey);
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    @Override
    public void close() {
        cache.cleanUp();
        log.info("Counter store closed with {} live counters", cache.estimatedSize());
    }

    private static final class RetentionExpiry implements Expiry<String, CounterState> {

        private final long minimumNanos;

        RetentionExpiry(long minimumNanos) {
            this.minimumNanos = minimumNanos;
        }

        @Override
        public long expireAfterCreate(String key, CounterState value, long currentTime) {
            return lifetime(value);
        }

        @Override
        public long expireAfterUpdate(String key, CounterState value, long currentTime, long currentDuration) {
            return lifetime(value);
        }

        @Override
        public long expireAfterRead(String key, CounterState value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long lifetime(CounterState value) {
            long retention = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, value.retentionMillis()));
            return Math.max(minimumNanos, retention);
        }
    }
}
