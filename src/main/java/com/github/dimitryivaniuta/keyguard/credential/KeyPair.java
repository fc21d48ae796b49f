package com.github.dimitryivaniuta.keyguard.credential;

/**
 * Freshly generated credential. The secret exists only here and in the response that hands it to
 * the key owner; the store keeps its HMAC.
 */
public record KeyPair(String keyId, String secret, String secretHash) {

    @Override
    public String toString() {
        return "KeyPair[keyId=" + keyId + ", secret=***]";
    }
}
