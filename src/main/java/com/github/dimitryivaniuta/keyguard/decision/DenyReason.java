package com.github.dimitryivaniuta.keyguard.decision;

import com.github.dimitryivaniuta.keyguard.lifecycle.LifecycleDenial;

/**
 * Internal denial taxonomy. {@link #code()} is what clients see; {@link #metricName()} keeps the
 * distinction between unknown key ids and wrong secrets for metrics and logs only.
 */
public enum DenyReason {
    CREDENTIAL_NOT_FOUND("not_found", "invalid_credential", 401),
    CREDENTIAL_INVALID("invalid_credential", "invalid_credential", 401),
    KEY_EXPIRED("expired", "expired", 403),
    KEY_REVOKED("revoked", "revoked", 403),
    KEY_INACTIVE("inactive", "inactive", 403),
    IP_RESTRICTED("ip_restricted", "ip_restricted", 403),
    RATE_LIMITED("rate_limited", "rate_limited", 429),
    STORE_UNAVAILABLE("store_unavailable", "store_unavailable", 503);

    private final String metricName;
    private final String code;
    private final int httpStatus;

    DenyReason(String metricName, String code, int httpStatus) {
        this.metricName = metricName;
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String metricName() {
        return metricName;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public static DenyReason from(LifecycleDenial denial) {
        return switch (denial) {
            case REVOKED -> KEY_REVOKED;
            case INACTIVE -> KEY_INACTIVE;
            case EXPIRED -> KEY_EXPIRED;
            case IP_RESTRICTED -> IP_RESTRICTED;
        };
    }
}
