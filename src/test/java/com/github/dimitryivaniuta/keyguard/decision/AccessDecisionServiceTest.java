package com.github.dimitryivaniuta.keyguard.decision;

import com.github.dimitryivaniuta.keyguard.clock.MutableTimeSource;
import com.github.dimitryivaniuta.keyguard.config.KeyGuardProperties;
import com.github.dimitryivaniuta.keyguard.credential.CredentialCodec;
import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.InMemoryKeyRecordStore;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.lifecycle.IpAllowListMatcher;
import com.github.dimitryivaniuta.keyguard.lifecycle.IssueKeyCommand;
import com.github.dimitryivaniuta.keyguard.lifecycle.IssuedKey;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyLifecycle;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyLifecycleService;
import com.github.dimitryivaniuta.keyguard.lifecycle.LastUsedRecorder;
import com.github.dimitryivaniuta.keyguard.lifecycle.RotationResult;
import com.github.dimitryivaniuta.keyguard.lifecycle.RotationTrigger;
import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitManager;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRuleResolver;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitScope;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.FixedWindowBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.SlidingWindowBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.backend.TokenBucketBackend;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyPolicy;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyTracker;
import com.github.dimitryivaniuta.keyguard.store.CaffeineCounterStore;
import com.github.dimitryivaniuta.keyguard.store.StoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccessDecisionServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final String IP = "10.0.0.1";

    private final MutableTimeSource time = new MutableTimeSource(T0);
    private final InMemoryKeyRecordStore keys = new InMemoryKeyRecordStore();
    private final CredentialCodec codec = new CredentialCodec("unit-test-signing-key-0123456789abcdef", 256);
    private final KeyLifecycle lifecycle = new KeyLifecycle(new IpAllowListMatcher(), Duration.ofDays(7));
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final KeyGuardMetrics metrics = new KeyGuardMetrics(registry);
    private final CaffeineCounterStore counters = new CaffeineCounterStore(Duration.ofMinutes(30), 10_000);
    private final RateLimitManager manager = new RateLimitManager(
            List.of(new FixedWindowBackend(counters), new SlidingWindowBackend(counters), new TokenBucketBackend(counters)),
            new PenaltyTracker(counters, PenaltyPolicy.defaults()),
            metrics);
    private final RateLimitRuleResolver rules = new RateLimitRuleResolver(
            List.of(RateLimitRule.tokenBucket("per-key", RateLimitScope.PER_API_KEY, 10, 1.0)),
            Map.of());
    private final KeyLifecycleService admin = new KeyLifecycleService(
            keys, codec, lifecycle, time, metrics, new KeyGuardProperties());

    private AccessDecisionService service(KeyRecordStore store, boolean failOpen) {
        KeyGuardProperties props = new KeyGuardProperties();
        props.setFailOpen(failOpen);
        return new AccessDecisionService(store, codec, lifecycle, rules, manager,
                new LastUsedRecorder(store, Runnable::run), metrics, time, props);
    }

    private final AccessDecisionService service = service(keys, false);

    private IssuedKey issue(Set<String> ipAllowList, Duration validity) {
        return admin.issue(new IssueKeyCommand("svc", "owner-1", Set.of(), null, validity, ipAllowList));
    }

    private Decision decide(IssuedKey key, Instant at) {
        return service.decide(key.record().getKeyId(), key.secret(), DecisionContext.of(IP, "/api/orders", at));
    }

    @Test
    void validKeyIsAllowedWithRateLimitHeaders() {
        IssuedKey key = issue(null, null);

        Decision d = decide(key, T0);

        assertThat(d.allowed()).isTrue();
        assertThat(d.httpStatus()).isEqualTo(200);
        assertThat(d.reason()).isNull();
        assertThat(d.keyRecord().getKeyId()).isEqualTo(key.record().getKeyId());
        assertThat(d.headers())
                .containsEntry(Decision.HEADER_LIMIT, "10")
                .containsEntry(Decision.HEADER_REMAINING, "9")
                .containsEntry(Decision.HEADER_ALGORITHM, "token_bucket")
                .containsKey(Decision.HEADER_RESET)
                .doesNotContainKey(Decision.HEADER_RETRY_AFTER);
    }

    @Test
    void allowRecordsLastUse() {
        IssuedKey key = issue(null, null);
        decide(key, T0.plusSeconds(3));
        assertThat(keys.get(key.record().getKeyId()).orElseThrow().getLastUsedAt()).isEqualTo(T0.plusSeconds(3));
    }

    @Test
    void unknownKeyAndWrongSecretLookTheSame() {
        IssuedKey key = issue(null, null);

        Decision unknown = service.decide("ak_doesnotexist", key.secret(), DecisionContext.of(IP, "/api/x", T0));
        Decision wrong = service.decide(key.record().getKeyId(), codec.generateKeyPair().secret(),
                DecisionContext.of(IP, "/api/x", T0));

        assertThat(unknown.reason()).isEqualTo("invalid_credential");
        assertThat(wrong.reason()).isEqualTo("invalid_credential");
        assertThat(unknown.httpStatus()).isEqualTo(401);
        assertThat(wrong.httpStatus()).isEqualTo(401);
        assertThat(unknown.headers()).isEqualTo(wrong.headers());

        assertThat(registry.get("key_guard_decisions_total").tag("reason", "not_found").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("key_guard_decisions_total").tag("reason", "invalid_credential").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void nullCredentialsAreDeniedWithoutThrowing() {
        Decision d = service.decide(null, null, DecisionContext.of(IP, "/api/x", T0));
        assertThat(d.allowed()).isFalse();
        assertThat(d.reason()).isEqualTo("invalid_credential");
    }

    @Test
    void lifecycleDenialsAreSpecific() {
        IssuedKey revoked = issue(null, null);
        admin.revoke(revoked.record().getKeyId());
        IssuedKey inactive = issue(null, null);
        admin.setEnabled(inactive.record().getKeyId(), false);
        IssuedKey expiring = issue(null, Duration.ofDays(1));
        IssuedKey restricted = issue(Set.of("192.168.0.0/16"), null);

        assertThat(decide(revoked, T0).reason()).isEqualTo("revoked");
        assertThat(decide(inactive, T0).reason()).isEqualTo("inactive");
        assertThat(decide(expiring, T0.plus(Duration.ofDays(2))).reason()).isEqualTo("expired");
        assertThat(decide(restricted, T0).reason()).isEqualTo("ip_restricted");
        assertThat(decide(restricted, T0).httpStatus()).isEqualTo(403);
    }

    @Test
    void rateLimitScenario() {
        IssuedKey key = issue(null, null);

        Decision last = null;
        for (int i = 0; i < 10; i++) {
            last = decide(key, T0);
            assertThat(last.allowed()).isTrue();
        }
        assertThat(last.remaining()).isZero();

        Decision eleventh = decide(key, T0);
        assertThat(eleventh.allowed()).isFalse();
        assertThat(eleventh.reason()).isEqualTo("rate_limited");
        assertThat(eleventh.httpStatus()).isEqualTo(429);
        assertThat(eleventh.retryAfterSeconds()).isEqualTo(1L);
        assertThat(eleventh.headers()).containsEntry(Decision.HEADER_RETRY_AFTER, "1");
        assertThat(eleventh.algorithm()).isEqualTo(RateLimitAlgorithm.TOKEN_BUCKET);

        Decision later = decide(key, T0.plusSeconds(5));
        assertThat(later.allowed()).isTrue();
        assertThat(later.remaining()).isEqualTo(4L);
    }

    @Test
    void credentialFailuresDoNotConsumeRateLimit() {
        IssuedKey key = issue(null, null);
        for (int i = 0; i < 20; i++) {
            service.decide(key.record().getKeyId(), "sk_wrong", DecisionContext.of(IP, "/api/x", T0));
        }
        assertThat(decide(key, T0).remaining()).isEqualTo(9L);
    }

    @Test
    void rotatedKeysBothPassDuringGrace() {
        IssuedKey old = issue(null, null);
        RotationResult r = admin.rotate(old.record().getKeyId(), RotationTrigger.MANUAL, Duration.ofHours(1));

        assertThat(decide(old, T0).allowed()).isTrue();
        assertThat(service.decide(r.newRecord().getKeyId(), r.newSecret(), DecisionContext.of(IP, "/api/x", T0))
                .allowed()).isTrue();

        Instant later = T0.plus(Duration.ofHours(2));
        assertThat(decide(old, later).reason()).isEqualTo("expired");
        assertThat(service.decide(r.newRecord().getKeyId(), r.newSecret(), DecisionContext.of(IP, "/api/x", later))
                .allowed()).isTrue();
    }

    @Test
    void storeFailureFailsClosedByDefault() {
        KeyRecordStore broken = mock(KeyRecordStore.class);
        when(broken.get(anyString())).thenThrow(new StoreUnavailableException("timeout"));

        Decision d = service(broken, false).decide("ak_1", "sk_x", DecisionContext.of(IP, "/api/x", T0));

        assertThat(d.allowed()).isFalse();
        assertThat(d.reason()).isEqualTo("store_unavailable");
        assertThat(d.httpStatus()).isEqualTo(503);
        assertThat(registry.get("key_guard_store_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unexpectedStoreErrorIsAlsoAVerdict() {
        KeyRecordStore broken = mock(KeyRecordStore.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("connection reset"));

        assertThat(service(broken, false).decide("ak_1", "sk_x", DecisionContext.of(IP, "/api/x", T0)).reason())
                .isEqualTo("store_unavailable");
    }

    @Test
    void failOpenAllowsOnStoreFailure() {
        KeyRecordStore broken = mock(KeyRecordStore.class);
        when(broken.get(anyString())).thenThrow(new StoreUnavailableException("timeout"));

        Decision d = service(broken, true).decide("ak_1", "sk_x", DecisionContext.of(IP, "/api/x", T0));

        assertThat(d.allowed()).isTrue();
        assertThat(d.keyRecord()).isNull();
        assertThat(d.headers()).isEmpty();
    }

    @Test
    void keyOwnerIsUsedForPerUserRulesWhenNoUserIsGiven() {
        RateLimitRuleResolver perUser = new RateLimitRuleResolver(
                List.of(RateLimitRule.fixedWindow("per-user", RateLimitScope.PER_USER, 1, 60)), Map.of());
        AccessDecisionService s = new AccessDecisionService(keys, codec, lifecycle, perUser, manager,
                new LastUsedRecorder(keys, Runnable::run), metrics, time, new KeyGuardProperties());
        IssuedKey first = issue(null, null);
        IssuedKey second = issue(null, null); // same owner

        assertThat(s.decide(first.record().getKeyId(), first.secret(), DecisionContext.of(IP, "/a", T0)).allowed())
                .isTrue();
        Decision d = s.decide(second.record().getKeyId(), second.secret(), DecisionContext.of(IP, "/a", T0));
        assertThat(d.reason()).isEqualTo("rate_limited");
    }

    @Test
    void decisionsAreTimed() {
        decide(issue(null, null), T0);
        assertThat(registry.get("key_guard_decision_duration_seconds").timer().count()).isEqualTo(1L);
    }
}
