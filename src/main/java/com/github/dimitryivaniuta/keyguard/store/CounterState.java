package com.github.dimitryivaniuta.keyguard.store;

/**
 * Value kept in a {@link CounterStore}.
 *
 * <p>{@link #retentionMillis()} is measured from the moment the state was written. Until it has passed, dropping
 * the state would change a decision (a window that is still open, a bucket that is not full yet, a penalty that
 * has not cooled down). Stores must keep the entry at least that long.
 */
public interface CounterState {

    long retentionMillis();
}
