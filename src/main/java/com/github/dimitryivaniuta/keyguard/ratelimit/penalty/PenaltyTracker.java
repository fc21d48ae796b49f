package com.github.dimitryivaniuta.keyguard.ratelimit.penalty;

import com.github.dimitryivaniuta.keyguard.store.CounterState;
import com.github.dimitryivaniuta.keyguard.store.CounterStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks repeat violators per composite rate limit key.
 *
 * <p>The multiplier only grows while violations keep coming; it drops back to baseline in one step once
 * {@link PenaltyPolicy#cooldown()} passes without a violation.
 */
@Slf4j
public class PenaltyTracker {

    private static final String KEY_PREFIX = "penalty:";

    private final CounterStore store;
    private final PenaltyPolicy policy;

    /** A record stops mattering once it has cooled down or fallen out of the counting window. */
    private record Entry(ViolationRecord record, long retentionMillis) implements CounterState {}

    public PenaltyTracker(CounterStore store, PenaltyPolicy policy) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public double currentMultiplier(String identifier, Instant now) {
        return find(identifier)
                .filter(r -> !r.cooledDown(now, policy))
                .map(ViolationRecord::penaltyMultiplier)
                .orElse(ViolationRecord.BASELINE);
    }

    public ViolationRecord recordViolation(String identifier, Instant now) {
        ViolationRecord updated = store.atomicUpdate(key(identifier), Entry.class, entry -> {
            ViolationRecord current = entry == null ? null : entry.record();
            boolean fresh = current == null || current.cooledDown(now, policy);
            int consecutive = (fresh || !current.withinWindow(now, policy)) ? 0 : current.consecutiveViolations();
            double multiplier = fresh ? ViolationRecord.BASELINE : current.penaltyMultiplier();

            consecutive++;
            if (consecutive % policy.threshold() == 0) {
                multiplier = Math.min(policy.maxMultiplier(), multiplier * policy.growthFactor());
            }
            return new Entry(new ViolationRecord(identifier, consecutive, multiplier, now), retentionMillis());
        }).record();

        if (updated.consecutiveViolations() % policy.threshold() == 0) {
            log.info("Penalty escalated for {} to x{} after {} consecutive violations",
                    identifier, updated.penaltyMultiplier(), updated.consecutiveViolations());
        }
        return updated;
    }

    /** Compliant request: clears the record once the cooldown has elapsed. No write for clean clients. */
    public void recordCompliance(String identifier, Instant now) {
        Optional<ViolationRecord> existing = find(identifier);
        if (existing.isEmpty() || !existing.get().cooledDown(now, policy)) {
            return;
        }
        store.atomicUpdate(key(identifier), Entry.class, entry ->
                (entry == null || entry.record().cooledDown(now, policy)) ? null : entry);
        log.debug("Penalty cleared for {}", identifier);
    }

    public Optional<ViolationRecord> find(String identifier) {
        return store.peek(key(identifier), Entry.class).map(Entry::record);
    }

    public void clear(String identifier) {
        store.remove(key(identifier));
    }

    public PenaltyPolicy policy() {
        return policy;
    }

    private long retentionMillis() {
        return Math.max(policy.cooldown().toMillis(), policy.window().toMillis());
    }

    private static String key(String identifier) {
        return KEY_PREFIX + identifier;
    }
}
