package com.github.dimitryivaniuta.keyguard.ratelimit;

/**
 * Identifiers of the caller for each scope. Missing identifiers disable the rules of that scope.
 */
public record RequestIdentity(String ip, String userId, String apiKeyId, String endpoint) {

    public static final String GLOBAL_IDENTIFIER = "*";

    /** Identity carrying only the identifier of {@code scope}, for looking up one caller's counters. */
    public static RequestIdentity forScope(RateLimitScope scope, String identifier) {
        return switch (scope) {
            case GLOBAL -> new RequestIdentity(null, null, null, null);
            case PER_IP -> new RequestIdentity(identifier, null, null, null);
            case PER_USER -> new RequestIdentity(null, identifier, null, null);
            case PER_API_KEY -> new RequestIdentity(null, null, identifier, null);
            case PER_ENDPOINT -> new RequestIdentity(null, null, null, identifier);
        };
    }

    public String identifierFor(RateLimitScope scope) {
        String value = switch (scope) {
            case GLOBAL -> GLOBAL_IDENTIFIER;
            case PER_IP -> ip;
            case PER_USER -> userId;
            case PER_API_KEY -> apiKeyId;
            case PER_ENDPOINT -> endpoint;
        };
        return (value == null || value.isBlank()) ? null : value;
    }
}
