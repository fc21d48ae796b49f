package com.github.dimitryivaniuta.keyguard.ratelimit;

import com.github.dimitryivaniuta.keyguard.config.KeyGuardProperties;
import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the rule list for a request: configured rules, then rules of every matching endpoint pattern,
 * with the key's rate limit override applied to per-key rules.
 *
 * <p>All definitions are validated in the constructor so a bad configuration fails at startup.
 */
@Slf4j
public class RateLimitRuleResolver {

    private final List<RateLimitRule> baseRules;
    private final Map<String, List<RateLimitRule>> endpointRules;
    private final PathMatcher pathMatcher = new AntPathMatcher();

    public RateLimitRuleResolver(KeyGuardProperties.RateLimit config) {
        Set<String> ids = new HashSet<>();
        this.baseRules = convert(config.getRules(), ids);

        Map<String, List<RateLimitRule>> byPattern = new LinkedHashMap<>();
        config.getEndpoints().forEach((pattern, defs) -> byPattern.put(pattern, convert(defs, ids)));
        this.endpointRules = byPattern;

        log.info("Loaded {} rate limit rules and {} endpoint patterns", baseRules.size(), endpointRules.size());
    }

    public RateLimitRuleResolver(List<RateLimitRule> baseRules, Map<String, List<RateLimitRule>> endpointRules) {
        this.baseRules = List.copyOf(baseRules);
        this.endpointRules = new LinkedHashMap<>(endpointRules);
    }

    public List<RateLimitRule> resolve(ApiKeyRecord key, String endpoint) {
        List<RateLimitRule> out = new ArrayList<>(baseRules);
        if (endpoint != null) {
            endpointRules.forEach((pattern, rules) -> {
                if (pathMatcher.match(pattern, endpoint)) {
                    out.addAll(rules);
                }
            });
        }
        Integer override = key == null ? null : key.getRateLimitOverride();
        if (override != null && override > 0) {
            out.replaceAll(r -> r.scope() == RateLimitScope.PER_API_KEY ? r.withCapacity(override) : r);
        }
        return out;
    }

    /** Every configured rule, global ones first, then endpoint rules in pattern order. */
    public List<RateLimitRule> allRules() {
        List<RateLimitRule> out = new ArrayList<>(baseRules);
        endpointRules.values().forEach(out::addAll);
        return out;
    }

    public Optional<RateLimitRule> findRule(String id) {
        return allRules().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    private static List<RateLimitRule> convert(List<KeyGuardProperties.RuleDefinition> defs, Set<String> seenIds) {
        List<RateLimitRule> rules = new ArrayList<>(defs.size());
        for (KeyGuardProperties.RuleDefinition def : defs) {
            RateLimitRule rule;
            try {
                rule = def.toRule();
            } catch (IllegalArgumentException | NullPointerException ex) {
                throw new IllegalStateException("Invalid rate limit rule '" + def.getId() + "': " + ex.getMessage(), ex);
            }
            if (!seenIds.add(rule.id())) {
                throw new IllegalStateException("Duplicate rate limit rule id '" + rule.id() + "'");
            }
            rules.add(rule);
        }
        return List.copyOf(rules);
    }
}
