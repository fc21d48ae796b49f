package com.github.dimitryivaniuta.keyguard.ratelimit;

/**
 * Dimension a rule limits. Declaration order is evaluation priority.
 */
public enum RateLimitScope {
    GLOBAL("global"),
    PER_IP("ip"),
    PER_USER("user"),
    PER_API_KEY("apiKey"),
    PER_ENDPOINT("endpoint");

    private final String tag;

    RateLimitScope(String tag) { this.tag = tag; }

    public String tag() { return tag; }

    public int priority() { return ordinal(); }
}
