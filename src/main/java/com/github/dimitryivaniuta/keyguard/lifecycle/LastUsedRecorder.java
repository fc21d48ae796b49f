package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.store.StoreUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Records {@code lastUsedAt} off the request path. Updates only move the timestamp forward and do not bump the
 * record version. They still replace the stored snapshot, so an administrative compare-and-swap racing one of
 * them fails and has to re-read; {@link KeyLifecycleService} retries those on a fresh read.
 */
@Slf4j
public class LastUsedRecorder {

    private final KeyRecordStore store;
    private final Executor executor;
    private final Retry retry;

    public LastUsedRecorder(KeyRecordStore store, Executor executor) {
        this(store, executor, defaultRetry());
    }

    public LastUsedRecorder(KeyRecordStore store, Executor executor, Retry retry) {
        this.store = store;
        this.executor = executor;
        this.retry = retry;
    }

    public static Retry defaultRetry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(5)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(10), 2.0))
                .retryExceptions(LastUsedConflict.class, StoreUnavailableException.class)
                .build();
        return Retry.of("key-guard:last-used", config);
    }

    /** Fire-and-forget. Failures are logged, never propagated to the caller. */
    public CompletableFuture<Void> record(String keyId, Instant usedAt) {
        try {
            return CompletableFuture
                    .runAsync(() -> Retry.decorateRunnable(retry, () -> touch(keyId, usedAt)).run(), executor)
                    .exceptionally(ex -> {
                        log.warn("Could not record last use of API key {}: {}", keyId, ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException ex) {
            log.warn("Last-use update for API key {} dropped: executor saturated", keyId);
            return CompletableFuture.completedFuture(null);
        }
    }

    void touch(String keyId, Instant usedAt) {
        Optional<ApiKeyRecord> found = store.get(keyId);
        if (found.isEmpty()) {
            return;
        }
        ApiKeyRecord current = found.get();
        if (current.getLastUsedAt() != null && !current.getLastUsedAt().isBefore(usedAt)) {
            return;
        }
        ApiKeyRecord touched = current.toBuilder().lastUsedAt(usedAt).build();
        if (!store.compareAndSwap(keyId, current, touched)) {
            throw new LastUsedConflict(keyId);
        }
    }

    static final class LastUsedConflict extends RuntimeException {
        LastUsedConflict(String keyId) {
            super("concurrent update of API key " + keyId);
        }
    }
}
