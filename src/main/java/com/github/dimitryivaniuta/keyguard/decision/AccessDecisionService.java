package com.github.dimitryivaniuta.keyguard.decision;

import com.github.dimitryivaniuta.keyguard.clock.TimeSource;
import com.github.dimitryivaniuta.keyguard.config.KeyGuardProperties;
import com.github.dimitryivaniuta.keyguard.credential.CredentialCodec;
import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyLifecycle;
import com.github.dimitryivaniuta.keyguard.lifecycle.LastUsedRecorder;
import com.github.dimitryivaniuta.keyguard.lifecycle.LifecycleVerdict;
import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitManager;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRuleResolver;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitVerdict;
import com.github.dimitryivaniuta.keyguard.ratelimit.RequestIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Single entry point for access decisions: credential, lifecycle, rate limits, in that order.
 *
 * <p>Never throws. Store failures become {@link DenyReason#STORE_UNAVAILABLE} unless
 * {@code key-guard.fail-open} is set.
 */
@Slf4j
@Service
public class AccessDecisionService {

    private final KeyRecordStore keys;
    private final CredentialCodec codec;
    private final KeyLifecycle lifecycle;
    private final RateLimitRuleResolver rules;
    private final RateLimitManager rateLimits;
    private final LastUsedRecorder lastUsed;
    private final KeyGuardMetrics metrics;
    private final TimeSource time;
    private final boolean failOpen;

    public AccessDecisionService(KeyRecordStore keys,
                                 CredentialCodec codec,
                                 KeyLifecycle lifecycle,
                                 RateLimitRuleResolver rules,
                                 RateLimitManager rateLimits,
                                 LastUsedRecorder lastUsed,
                                 KeyGuardMetrics metrics,
                                 TimeSource time,
                                 KeyGuardProperties properties) {
        this.keys = keys;
        this.codec = codec;
        this.lifecycle = lifecycle;
        this.rules = rules;
        this.rateLimits = rateLimits;
        this.lastUsed = lastUsed;
        this.metrics = metrics;
        this.time = time;
        this.failOpen = properties.isFailOpen();
    }

    public Decision decide(String keyId, String secret, DecisionContext ctx) {
        long start = time.monotonicNanos();
        try {
            Decision decision = evaluate(keyId, secret, ctx);
            if (decision.allowed()) {
                metrics.decisionAllowed();
            }
            return decision;
        } finally {
            metrics.recordDecisionDuration(time.monotonicNanos() - start);
        }
    }

    private Decision evaluate(String keyId, String secret, DecisionContext ctx) {
        Optional<ApiKeyRecord> found;
        try {
            found = (keyId == null || keyId.isBlank()) ? Optional.empty() : keys.get(keyId);
        } catch (RuntimeException ex) {
            return storeFailure("key_lookup", ex, null);
        }

        if (found.isEmpty()) {
            codec.verifyAbsent(secret);
            return deny(DenyReason.CREDENTIAL_NOT_FOUND, keyId);
        }
        ApiKeyRecord record = found.get();

        if (!codec.verify(secret, record.getSecretHash())) {
            return deny(DenyReason.CREDENTIAL_INVALID, keyId);
        }

        LifecycleVerdict lv = lifecycle.check(record, ctx.now(), ctx.ip());
        if (!lv.allowed()) {
            return deny(DenyReason.from(lv.denial()), keyId);
        }

        RateLimitVerdict verdict;
        try {
            List<RateLimitRule> applicable = rules.resolve(record, ctx.endpoint());
            String userId = ctx.userId() != null ? ctx.userId() : record.getOwnerId();
            RequestIdentity identity = new RequestIdentity(ctx.ip(), userId, record.getKeyId(), ctx.endpoint());
            verdict = rateLimits.evaluate(identity, applicable, ctx.now());
        } catch (RuntimeException ex) {
            return storeFailure("counter_update", ex, record);
        }

        if (!verdict.allowed()) {
            metrics.decisionDenied(DenyReason.RATE_LIMITED.metricName());
            log.debug("Key {} rate limited by rule {}", keyId,
                    verdict.limitingRule() == null ? "?" : verdict.limitingRule().id());
            return Decision.rateLimited(verdict);
        }

        lastUsed.record(record.getKeyId(), ctx.now());
        return Decision.allow(record, verdict);
    }

    private Decision deny(DenyReason reason, String keyId) {
        metrics.decisionDenied(reason.metricName());
        log.debug("Denied key {}: {}", keyId, reason.metricName());
        return Decision.deny(reason);
    }

    private Decision storeFailure(String operation, RuntimeException ex, ApiKeyRecord record) {
        metrics.storeFailure(operation);
        if (failOpen) {
            log.warn("Store failure during {}, allowing request (fail-open): {}", operation, ex.getMessage());
            return Decision.allowUnchecked(record);
        }
        log.error("Store failure during {}, denying request", operation, ex);
        metrics.decisionDenied(DenyReason.STORE_UNAVAILABLE.metricName());
        return Decision.deny(DenyReason.STORE_UNAVAILABLE);
    }
}
