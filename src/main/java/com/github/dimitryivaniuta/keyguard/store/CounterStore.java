package com.github.dimitryivaniuta.keyguard.store;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Atomic read-modify-write storage for rate limit counters and violation records.
 *
 * <p>{@code updateFn} receives the current state ({@code null} when absent) and must be pure: stores
 * built on compare-and-swap may invoke it more than once. Returning {@code null} removes the entry.
 * Atomicity is scoped to a single composite key. A key holding a state of another type is an
 * {@link IllegalStateException}.
 */
public interface CounterStore {

    <S extends CounterState> S atomicUpdate(String compositeKey, Class<S> type, UnaryOperator<S> updateFn);

    <S extends CounterState> Optional<S> peek(String compositeKey, Class<S> type);

    void remove(String compositeKey);
}
