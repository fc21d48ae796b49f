package com.github.dimitryivaniuta.keyguard.lifecycle;

public enum LifecycleDenial {
    REVOKED("revoked"),
    INACTIVE("inactive"),
    EXPIRED("expired"),
    IP_RESTRICTED("ip_restricted");

    private final String code;

    LifecycleDenial(String code) { this.code = code; }

    public String code() { return code; }
}
