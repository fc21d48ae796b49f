package com.github.dimitryivaniuta.keyguard.web;

public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String API_KEY_ID_MDC_KEY = "apiKeyId";
    /** Request attribute holding the {@code ApiKeyRecord} of an allowed request. */
    public static final String API_KEY_RECORD_ATTRIBUTE = "keyGuard.apiKeyRecord";
}
