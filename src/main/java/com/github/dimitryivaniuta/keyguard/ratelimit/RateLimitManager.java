package com.github.dimitryivaniuta.keyguard.ratelimit;

import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.RateLimitBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyTracker;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.ViolationRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates every applicable rule for a request in scope priority order
 * (global, ip, user, api key, endpoint) and stops at the first denial.
 *
 * <p>Rules after a denying rule are never consumed. Rules already passed keep their consumption.
 */
@Slf4j
public class RateLimitManager {

    private static final Comparator<RateLimitRule> PRIORITY =
            Comparator.comparingInt(r -> r.scope().priority());

    private final Map<RateLimitAlgorithm, RateLimitBackend> backends = new EnumMap<>(RateLimitAlgorithm.class);
    private final PenaltyTracker penalties;
    private final KeyGuardMetrics metrics;

    public RateLimitManager(Collection<? extends RateLimitBackend> backends,
                            PenaltyTracker penalties,
                            KeyGuardMetrics metrics) {
        for (RateLimitBackend b : backends) {
            if (this.backends.putIfAbsent(b.algorithm(), b) != null) {
                throw new IllegalStateException("Duplicate backend for " + b.algorithm());
            }
        }
        this.penalties = Objects.requireNonNull(penalties, "penalties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public RateLimitVerdict evaluate(RequestIdentity identity, List<RateLimitRule> rules, Instant now) {
        RateLimitVerdict tightest = null;

        for (RateLimitRule rule : ordered(rules)) {
            String identifier = identity.identifierFor(rule.scope());
            if (identifier == null) {
                continue;
            }
            String scopeKey = scopeKey(rule, identifier);

            double multiplier = rule.progressive() ? penalties.currentMultiplier(scopeKey, now) : ViolationRecord.BASELINE;
            ConsumeResult result = backend(rule).tryConsume(scopeKey, rule.penalized(multiplier), now);

            if (!result.allowed()) {
                metrics.rateLimitRejected(rule.scope(), rule.algorithm());
                if (rule.progressive()) {
                    ViolationRecord v = penalties.recordViolation(scopeKey, now);
                    if (v.penaltyMultiplier() > multiplier) {
                        metrics.penaltyEscalated(rule.scope());
                    }
                }
                log.debug("Rate limit rule {} denied {} (retry after {}s, penalty x{})",
                        rule.id(), scopeKey, result.retryAfterSeconds(), multiplier);
                return RateLimitVerdict.of(rule, result);
            }

            if (rule.progressive()) {
                penalties.recordCompliance(scopeKey, now);
            }
            if (tightest == null || result.remaining() < tightest.remaining()) {
                tightest = RateLimitVerdict.of(rule, result);
            }
        }
        return tightest != null ? tightest : RateLimitVerdict.unlimited();
    }

    /** Status of every applicable rule without consuming anything. */
    public List<RateLimitVerdict> status(RequestIdentity identity, List<RateLimitRule> rules, Instant now) {
        List<RateLimitVerdict> out = new ArrayList<>();
        for (RateLimitRule rule : ordered(rules)) {
            String identifier = identity.identifierFor(rule.scope());
            if (identifier == null) continue;
            String scopeKey = scopeKey(rule, identifier);
            double multiplier = rule.progressive() ? penalties.currentMultiplier(scopeKey, now) : ViolationRecord.BASELINE;
            out.add(RateLimitVerdict.of(rule, backend(rule).peek(scopeKey, rule.penalized(multiplier), now)));
        }
        return out;
    }

    /** Clears counters and penalty state of one rule for one caller. */
    public void reset(RequestIdentity identity, RateLimitRule rule) {
        String identifier = identity.identifierFor(rule.scope());
        if (identifier == null) return;
        String scopeKey = scopeKey(rule, identifier);
        backend(rule).reset(scopeKey);
        penalties.clear(scopeKey);
        log.info("Rate limit state reset for {}", scopeKey);
    }

    /** Multiplier currently applied to {@code identifier} under {@code rule}; baseline for non-progressive rules. */
    public double penaltyMultiplier(RateLimitRule rule, String identifier, Instant now) {
        if (!rule.progressive() || identifier == null) {
            return ViolationRecord.BASELINE;
        }
        return penalties.currentMultiplier(scopeKey(rule, identifier), now);
    }

    public static String scopeKey(RateLimitRule rule, String identifier) {
        return "rl:" + rule.scope().tag() + ":" + identifier + ":" + rule.id();
    }

    private RateLimitBackend backend(RateLimitRule rule) {
        RateLimitBackend backend = backends.get(rule.algorithm());
        if (backend == null) {
            throw new IllegalStateException("No backend registered for " + rule.algorithm());
        }
        return backend;
    }

    private static List<RateLimitRule> ordered(List<RateLimitRule> rules) {
        List<RateLimitRule> copy = new ArrayList<>(rules);
        copy.sort(PRIORITY); // stable: configuration order kept within a scope
        return copy;
    }
}
