package com.github.dimitryivaniuta.keyguard.clock;

import java.time.Instant;

/**
 * Source of time for the guard.
 *
 * <p>Wall-clock {@link #now()} drives expiry, windows and refills; {@link #monotonicNanos()} is only
 * used for measuring durations (metrics), never for persisted state.
 */
public interface TimeSource {

    Instant now();

    long monotonicNanos();
}
