package com.github.dimitryivaniuta.keyguard.decision;

import java.util.Optional;

/**
 * Splits an {@code X-API-Key} value of the form {@code keyId.secret}.
 */
public final class ApiKeyHeaderParser {

    public static final String HEADER = "X-API-Key";

    private ApiKeyHeaderParser() {
    }

    public static Optional<PresentedCredential> parse(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String value = header.trim();
        int dot = value.indexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new PresentedCredential(value.substring(0, dot), value.substring(dot + 1)));
    }

    public record PresentedCredential(String keyId, String secret) {
        @Override
        public String toString() {
            return "PresentedCredential[keyId=" + keyId + ", secret=***]";
        }
    }
}
