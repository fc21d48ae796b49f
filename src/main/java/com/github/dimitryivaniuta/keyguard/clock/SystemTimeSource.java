package com.github.dimitryivaniuta.keyguard.clock;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

public final class SystemTimeSource implements TimeSource {

    private final Clock clock;

    public SystemTimeSource() {
        this(Clock.systemUTC());
    }

    public SystemTimeSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public long monotonicNanos() {
        return System.nanoTime();
    }
}
