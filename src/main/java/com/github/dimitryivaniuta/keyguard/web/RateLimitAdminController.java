package com.github.dimitryivaniuta.keyguard.web;

import com.github.dimitryivaniuta.keyguard.clock.TimeSource;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitManager;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRuleResolver;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitScope;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitVerdict;
import com.github.dimitryivaniuta.keyguard.ratelimit.RequestIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

/**
 * Operator view of the rate limit counters: configured rules, one caller's state under a rule, and a manual reset
 * that clears both the counter and the penalty record.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/rate-limits")
public class RateLimitAdminController {

    private final RateLimitRuleResolver rules;
    private final RateLimitManager manager;
    private final TimeSource time;

    public record RuleResponse(
            String id,
            RateLimitScope scope,
            RateLimitAlgorithm algorithm,
            int capacity,
            Long windowSeconds,
            Double refillRatePerSecond,
            boolean progressive
    ) {
        static RuleResponse from(RateLimitRule r) {
            return new RuleResponse(r.id(), r.scope(), r.algorithm(), r.capacity(),
                    r.algorithm().isWindowed() ? r.windowSeconds() : null,
                    r.algorithm().isWindowed() ? null : r.refillRatePerSecond(),
                    r.progressive());
        }
    }

    public record RuleStatusResponse(
            String ruleId,
            RateLimitScope scope,
            RateLimitAlgorithm algorithm,
            String identifier,
            boolean wouldAllow,
            Long limit,
            Long remaining,
            Instant resetAt,
            Long retryAfterSeconds,
            double penaltyMultiplier
    ) {}

    public record ResetResponse(String ruleId, String identifier, Instant resetAt) {}

    @GetMapping("/rules")
    public List<RuleResponse> rules() {
        return rules.allRules().stream().map(RuleResponse::from).toList();
    }

    @GetMapping("/{ruleId}/{identifier}")
    public RuleStatusResponse status(@PathVariable String ruleId, @PathVariable String identifier) {
        RateLimitRule rule = rule(ruleId);
        Instant now = time.now();
        RequestIdentity identity = RequestIdentity.forScope(rule.scope(), identifier);
        String scoped = identity.identifierFor(rule.scope());

        RateLimitVerdict v = manager.status(identity, List.of(rule), now).stream()
                .findFirst()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "identifier must not be blank"));
        return new RuleStatusResponse(rule.id(), rule.scope(), rule.algorithm(), scoped,
                v.allowed(), v.limit(), v.remaining(), v.resetAt(), v.retryAfterSeconds(),
                manager.penaltyMultiplier(rule, scoped, now));
    }

    @PostMapping("/{ruleId}/{identifier}/reset")
    public ResetResponse reset(@PathVariable String ruleId, @PathVariable String identifier) {
        RateLimitRule rule = rule(ruleId);
        RequestIdentity identity = RequestIdentity.forScope(rule.scope(), identifier);
        manager.reset(identity, rule);
        return new ResetResponse(rule.id(), identity.identifierFor(rule.scope()), time.now());
    }

    private RateLimitRule rule(String ruleId) {
        return rules.findRule(ruleId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown rate limit rule " + ruleId));
    }
}
