package com.github.dimitryivaniuta.keyguard.config;

import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitAlgorithm;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitRule;
import com.github.dimitryivaniuta.keyguard.ratelimit.RateLimitScope;
import com.github.dimitryivaniuta.keyguard.ratelimit.penalty.PenaltyPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "key-guard")
public class KeyGuardProperties {

    /**
     * Allow requests when a store is unavailable. Trades security for availability; off by default.
     */
    private boolean failOpen = false;

    private final Credential credential = new Credential();
    private final RateLimit rateLimit = new RateLimit();
    private final Penalty penalty = new Penalty();
    private final Lifecycle lifecycle = new Lifecycle();
    private final Counters counters = new Counters();
    private final Web web = new Web();

    @Getter
    @Setter
    public static class Credential {
        /** Server-held HMAC key for secret hashes. At least 32 characters; rotating it invalidates every key. */
        private String signingKey;
        private int maxSecretLength = 256;
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Rules applied to every request. */
        private List<RuleDefinition> rules = new ArrayList<>();
        /** Extra rules per endpoint pattern (Ant style, e.g. "/api/payments/**"). */
        private Map<String, List<RuleDefinition>> endpoints = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class RuleDefinition {
        private String id;
        private RateLimitScope scope;
        private RateLimitAlgorithm algorithm = RateLimitAlgorithm.TOKEN_BUCKET;
        private int capacity;
        private Long windowSeconds;
        private Double refillRatePerSecond;
        private boolean progressive = false;

        public RateLimitRule toRule() {
            if (algorithm == null) {
                throw new IllegalArgumentException("algorithm must be set (rule " + id + ")");
            }
            RateLimitRule rule = switch (algorithm) {
                case FIXED_WINDOW -> RateLimitRule.fixedWindow(id, scope, capacity, orZero(windowSeconds));
                case SLIDING_WINDOW -> RateLimitRule.slidingWindow(id, scope, capacity, orZero(windowSeconds));
                case TOKEN_BUCKET -> RateLimitRule.tokenBucket(id, scope, capacity,
                        refillRatePerSecond == null ? 0d : refillRatePerSecond);
            };
            return progressive ? rule.asProgressive() : rule;
        }

        private static long orZero(Long v) {
            return v == null ? 0L : v;
        }
    }

    @Getter
    @Setter
    public static class Penalty {
        private int threshold = 5;
        private Duration window = Duration.ofMinutes(1);
        private Duration cooldown = Duration.ofMinutes(5);
        private double growthFactor = 2.0d;
        private double maxMultiplier = 16.0d;

        public PenaltyPolicy toPolicy() {
            return new PenaltyPolicy(threshold, window, cooldown, growthFactor, maxMultiplier);
        }
    }

    @Getter
    @Setter
    public static class Lifecycle {
        /** Keys expiring within this period report EXPIRING_SOON. */
        private Duration expiringSoon = Duration.ofDays(7);
        /** Upper bound for expiration extensions, counted from now. */
        private int maxExpirationDays = 365;
        /** Attempts for CAS-based administrative updates before giving up. */
        private int maxCasAttempts = 5;
        private boolean sweepEnabled = true;
        private String sweepCron = "0 */5 * * * *";
    }

    @Getter
    @Setter
    public static class Counters {
        /** Lower bound on how long a counter is kept; each counter also lives as long as its window needs. */
        private Duration minimumTtl = Duration.ofHours(1);
        private long maximumSize = 1_000_000L;
    }

    @Getter
    @Setter
    public static class Web {
        private boolean enabled = true;
        /** Paths guarded by the API key filter. */
        private List<String> protectedPaths = new ArrayList<>(List.of("/api/**"));
        /** Take the client address from X-Forwarded-For / X-Real-IP. Enable only behind a trusted proxy. */
        private boolean trustForwardedHeaders = false;
    }
}
