package com.github.dimitryivaniuta.keyguard.metrics;

import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitScope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class KeyGuardMetrics {

    private final MeterRegistry registry;

    public KeyGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Decisions ----
    public void decisionAllowed() {
        Counter.builder("key_guard_decisions_total")
                .tag("outcome", "allowed")
                .tag("reason", "none")
                .register(registry)
                .increment();
    }

    public void decisionDenied(String internalReason) {
        Counter.builder("key_guard_decisions_total")
                .tag("outcome", "denied")
                .tag("reason", internalReason) // not_found | invalid_credential | expired | ... (internal taxonomy)
                .register(registry)
                .increment();
    }

    public void recordDecisionDuration(long nanos) {
        Timer.builder("key_guard_decision_duration_seconds")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Rate limiting ----
    public void rateLimitRejected(RateLimitScope scope, RateLimitAlgorithm algorithm) {
        Counter.builder("key_guard_ratelimit_rejected_total")
                .tag("scope", scope.tag())
                .tag("algorithm", algorithm.headerValue())
                .register(registry)
                .increment();
    }

    public void penaltyEscalated(RateLimitScope scope) {
        Counter.builder("key_guard_penalty_escalations_total")
                .tag("scope", scope.tag())
                .register(registry)
                .increment();
    }

    // ---- Lifecycle ----
    public void keyRotated(String trigger) {
        Counter.builder("key_guard_key_rotations_total")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void keyTransition(String status) {
        Counter.builder("key_guard_key_transitions_total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    // ---- Store ----
    public void storeFailure(String operation) {
        Counter.builder("key_guard_store_failures_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
