package com.github.dimitryivaniuta.keyguard.ratelimit;

public enum RateLimitAlgorithm {
    FIXED_WINDOW("fixed_window"),
    SLIDING_WINDOW("sliding_window"),
    TOKEN_BUCKET("token_bucket");

    private final String headerValue;

    RateLimitAlgorithm(String headerValue) { this.headerValue = headerValue; }

    /** Value of the {@code X-RateLimit-Algorithm} header. */
    public String headerValue() { return headerValue; }

    public boolean isWindowed() {
        return this != TOKEN_BUCKET;
    }
}
