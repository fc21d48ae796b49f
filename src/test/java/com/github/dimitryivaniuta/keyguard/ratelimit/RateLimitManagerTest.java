package com.github.dimitryivaniuta.keyguard.ratelimit;

import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.FixedWindowBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.SlidingWindowBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.TokenBucketBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyPolicy;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyTracker;
import com.github.dimitryivaniuta.keyguard.store.CaffeineCounterStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitManagerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final CaffeineCounterStore store = new CaffeineCounterStore(Duration.ofMinutes(30), 10_000);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PenaltyTracker penalties = new PenaltyTracker(store, PenaltyPolicy.defaults());
    private final RateLimitManager manager = new RateLimitManager(
            List.of(new FixedWindowBackend(store), new SlidingWindowBackend(store), new TokenBucketBackend(store)),
            penalties,
            new KeyGuardMetrics(registry));

    private final RequestIdentity alice = new RequestIdentity("10.0.0.1", "alice", "ak_alice", "/api/orders");

    @Test
    void noRulesMeansUnlimited() {
        RateLimitVerdict v = manager.evaluate(alice, List.of(), T0);
        assertThat(v.allowed()).isTrue();
        assertThat(v.limit()).isNull();
        assertThat(v.remaining()).isNull();
    }

    @Test
    void denialShortCircuitsLowerPriorityRules() {
        RateLimitRule perKey = RateLimitRule.fixedWindow("per-key", RateLimitScope.PER_API_KEY, 100, 60);
        RateLimitRule perIp = RateLimitRule.fixedWindow("per-ip", RateLimitScope.PER_IP, 2, 60);
        // configuration order deliberately reversed: per-ip must still be evaluated first
        List<RateLimitRule> rules = List.of(perKey, perIp);

        manager.evaluate(alice, rules, T0);
        manager.evaluate(alice, rules, T0);
        RateLimitVerdict denied = manager.evaluate(alice, rules, T0);

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.limitingRule()).isEqualTo(perIp);
        assertThat(denied.retryAfterSeconds()).isEqualTo(60);

        List<RateLimitVerdict> status = manager.status(alice, rules, T0);
        RateLimitVerdict keyStatus = status.stream().filter(s -> s.limitingRule().equals(perKey)).findFirst().orElseThrow();
        assertThat(keyStatus.remaining()).isEqualTo(98);
        assertThat(registry.get("key_guard_ratelimit_rejected_total").tag("scope", "ip").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void allowedVerdictReportsTightestRule() {
        RateLimitRule global = RateLimitRule.tokenBucket("global", RateLimitScope.GLOBAL, 1000, 100);
        RateLimitRule perKey = RateLimitRule.slidingWindow("per-key", RateLimitScope.PER_API_KEY, 5, 60);

        RateLimitVerdict v = manager.evaluate(alice, List.of(global, perKey), T0);

        assertThat(v.allowed()).isTrue();
        assertThat(v.limitingRule()).isEqualTo(perKey);
        assertThat(v.limit()).isEqualTo(5);
        assertThat(v.remaining()).isEqualTo(4);
        assertThat(v.algorithm()).isEqualTo(RateLimitAlgorithm.SLIDING_WINDOW);
    }

    @Test
    void rulesWithoutIdentifierAreSkipped() {
        RequestIdentity anonymous = new RequestIdentity("10.0.0.1", null, "ak_x", null);
        RateLimitRule perUser = RateLimitRule.fixedWindow("per-user", RateLimitScope.PER_USER, 1, 60);

        assertThat(manager.evaluate(anonymous, List.of(perUser), T0).allowed()).isTrue();
        assertThat(manager.evaluate(anonymous, List.of(perUser), T0).allowed()).isTrue();
    }

    @Test
    void scopesAreCountedPerIdentifier() {
        RateLimitRule perKey = RateLimitRule.fixedWindow("per-key", RateLimitScope.PER_API_KEY, 1, 60);
        RequestIdentity bob = new RequestIdentity("10.0.0.2", "bob", "ak_bob", "/api/orders");

        assertThat(manager.evaluate(alice, List.of(perKey), T0).allowed()).isTrue();
        assertThat(manager.evaluate(bob, List.of(perKey), T0).allowed()).isTrue();
        assertThat(manager.evaluate(alice, List.of(perKey), T0).allowed()).isFalse();
    }

    @Test
    void progressiveRuleShrinksCapacityAfterRepeatedViolations() {
        RateLimitRule perKey = RateLimitRule.fixedWindow("per-key", RateLimitScope.PER_API_KEY, 4, 60).asProgressive();
        List<RateLimitRule> rules = List.of(perKey);

        assertThat(admitted(rules, T0, 4)).isEqualTo(4);
        for (int i = 0; i < 5; i++) {
            assertThat(manager.evaluate(alice, rules, T0.plusSeconds(1)).allowed()).isFalse();
        }
        String scopeKey = RateLimitManager.scopeKey(perKey, "ak_alice");
        assertThat(penalties.currentMultiplier(scopeKey, T0.plusSeconds(2))).isEqualTo(2.0);
        assertThat(registry.get("key_guard_penalty_escalations_total").counter().count()).isEqualTo(1.0);

        // same window boundaries as before, half the capacity
        RateLimitVerdict first = manager.evaluate(alice, rules, T0.plusSeconds(60));
        assertThat(first.allowed()).isTrue();
        assertThat(first.limit()).isEqualTo(2);
        assertThat(first.resetAt()).isEqualTo(T0.plusSeconds(120));
        assertThat(manager.evaluate(alice, rules, T0.plusSeconds(61)).allowed()).isTrue();
        RateLimitVerdict denied = manager.evaluate(alice, rules, T0.plusSeconds(62));
        assertThat(denied.allowed()).isFalse();
        assertThat(denied.retryAfterSeconds()).isEqualTo(58);
    }

    @Test
    void penalizedSlidingWindowNeverAdmitsMoreThanPlainOne() {
        RateLimitRule plain = RateLimitRule.slidingWindow("plain", RateLimitScope.PER_API_KEY, 10, 60);
        RateLimitRule strict = RateLimitRule.slidingWindow("strict", RateLimitScope.PER_API_KEY, 10, 60).asProgressive();

        for (RateLimitRule rule : List.of(plain, strict)) {
            assertThat(admitted(List.of(rule), T0.plusSeconds(61), 10)).isEqualTo(10);
            assertThat(admitted(List.of(rule), T0.plusSeconds(62), 5)).isZero();
        }
        assertThat(penalties.currentMultiplier(RateLimitManager.scopeKey(strict, "ak_alice"), T0.plusSeconds(62)))
                .isEqualTo(2.0);

        // rollover: the previous window's ten requests still weigh fully at t=120
        assertThat(admitted(List.of(plain), T0.plusSeconds(120), 10)).isZero();
        assertThat(admitted(List.of(strict), T0.plusSeconds(120), 10)).isZero();

        int plainMidWindow = admitted(List.of(plain), T0.plusSeconds(150), 10);
        int strictMidWindow = admitted(List.of(strict), T0.plusSeconds(150), 10);
        assertThat(plainMidWindow).isEqualTo(5);
        assertThat(strictMidWindow).isZero();

        int plainNextWindow = admitted(List.of(plain), T0.plusSeconds(180), 10);
        int strictNextWindow = admitted(List.of(strict), T0.plusSeconds(180), 10);
        assertThat(strictNextWindow).isLessThanOrEqualTo(plainNextWindow);
    }

    @Test
    void nonProgressiveRuleNeverEscalates() {
        RateLimitRule perKey = RateLimitRule.fixedWindow("per-key", RateLimitScope.PER_API_KEY, 1, 60);
        for (int i = 0; i < 20; i++) {
            manager.evaluate(alice, List.of(perKey), T0);
        }
        assertThat(penalties.find(RateLimitManager.scopeKey(perKey, "ak_alice"))).isEmpty();
    }

    @Test
    void resetClearsCountersAndPenalty() {
        RateLimitRule perKey = RateLimitRule.fixedWindow("per-key", RateLimitScope.PER_API_KEY, 1, 60).asProgressive();
        for (int i = 0; i < 6; i++) {
            manager.evaluate(alice, List.of(perKey), T0);
        }
        manager.reset(alice, perKey);

        assertThat(penalties.find(RateLimitManager.scopeKey(perKey, "ak_alice"))).isEmpty();
        assertThat(manager.evaluate(alice, List.of(perKey), T0).allowed()).isTrue();
    }

    @Test
    void duplicateBackendIsRejected() {
        assertThatThrownBy(() -> new RateLimitManager(
                List.of(new FixedWindowBackend(store), new FixedWindowBackend(store)),
                penalties, new KeyGuardMetrics(registry)))
                .isInstanceOf(IllegalStateException.class);
    }

    private int admitted(List<RateLimitRule> rules, Instant at, int attempts) {
        int allowed = 0;
        for (int i = 0; i < attempts; i++) {
            if (manager.evaluate(alice, rules, at).allowed()) {
                allowed++;
            }
        }
        return allowed;
    }
}
