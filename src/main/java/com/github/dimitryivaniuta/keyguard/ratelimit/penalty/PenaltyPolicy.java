package com.github.dimitryivaniuta.keyguard.ratelimit.penalty;

import java.time.Duration;
import java.util.Objects;

/**
 * Progressive penalty tuning.
 *
 * @param threshold violations within {@code window} that trigger one escalation step
 * @param window maximum gap between violations that still counts as consecutive
 * @param cooldown violation-free period after which the client returns to baseline
 * @param growthFactor multiplier growth per escalation step
 * @param maxMultiplier cap on the multiplier
 */
public record PenaltyPolicy(
        int threshold,
        Duration window,
        Duration cooldown,
        double growthFactor,
        double maxMultiplier
) {

    public PenaltyPolicy {
        if (threshold < 1) throw new IllegalArgumentException("penalty threshold must be >= 1");
        Objects.requireNonNull(window, "penalty window must not be null");
        Objects.requireNonNull(cooldown, "penalty cooldown must not be null");
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("penalty window must be positive");
        if (cooldown.isNegative() || cooldown.isZero()) throw new IllegalArgumentException("penalty cooldown must be positive");
        if (!(growthFactor > 1.0d)) throw new IllegalArgumentException("penalty growthFactor must be > 1");
        if (maxMultiplier < 1.0d) throw new IllegalArgumentException("penalty maxMultiplier must be >= 1");
    }

    public static PenaltyPolicy defaults() {
        return new PenaltyPolicy(5, Duration.ofMinutes(1), Duration.ofMinutes(5), 2.0d, 16.0d);
    }
}
