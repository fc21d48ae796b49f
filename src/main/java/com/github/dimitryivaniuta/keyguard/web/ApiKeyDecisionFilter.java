package com.github.dimitryivaniuta.keyguard.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.keyguard.clock.TimeSource;
import com.github.dimitryivaniuta.keyguard.config.KeyGuardProperties;
import com.github.dimitryivaniuta.keyguard.decision.AccessDecisionService;
import com.github.dimitryivaniuta.keyguard.decision.ApiKeyHeaderParser;
import com.github.dimitryivaniuta.keyguard.decision.Decision;
import com.github.dimitryivaniuta.keyguard.decision.DecisionContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.List;

/**
 * Guards the configured paths with {@link AccessDecisionService}: reads {@code X-API-Key}, always writes the
 * rate limit headers, and either continues the chain or answers with an {@link GlobalExceptionHandler.ApiError}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
@ConditionalOnProperty(prefix = "key-guard.web", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ApiKeyDecisionFilter extends OncePerRequestFilter {

    static final String MISSING_API_KEY = "missing_api_key";

    private final AccessDecisionService decisions;
    private final ObjectMapper objectMapper;
    private final TimeSource time;
    private final List<String> protectedPaths;
    private final boolean trustForwardedHeaders;
    private final PathMatcher pathMatcher = new AntPathMatcher();

    public ApiKeyDecisionFilter(AccessDecisionService decisions,
                                ObjectMapper objectMapper,
                                TimeSource time,
                                KeyGuardProperties properties) {
        this.decisions = decisions;
        this.objectMapper = objectMapper;
        this.time = time;
        this.protectedPaths = List.copyOf(properties.getWeb().getProtectedPaths());
        this.trustForwardedHeaders = properties.getWeb().isTrustForwardedHeaders();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true; // CORS preflight carries no credentials
        }
        String path = pathWithinApplication(request);
        return protectedPaths.stream().noneMatch(p -> pathMatcher.match(p, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String raw = ClientIpResolver.header(request, ApiKeyHeaderParser.HEADER);
        if (raw == null) {
            writeError(response, request, HttpStatus.UNAUTHORIZED, MISSING_API_KEY);
            return;
        }

        Principal principal = request.getUserPrincipal();
        DecisionContext ctx = new DecisionContext(
                ClientIpResolver.resolve(request, trustForwardedHeaders),
                pathWithinApplication(request),
                principal == null ? null : principal.getName(),
                time.now());

        // a value without the keyId.secret shape still costs one HMAC before it is rejected
        Decision decision = ApiKeyHeaderParser.parse(raw)
                .map(c -> decisions.decide(c.keyId(), c.secret(), ctx))
                .orElseGet(() -> decisions.decide(null, raw, ctx));

        decision.headers().forEach(response::setHeader);

        if (!decision.allowed()) {
            writeError(response, request, HttpStatus.valueOf(decision.httpStatus()), decision.reason());
            return;
        }

        request.setAttribute(RequestContextKeys.API_KEY_RECORD_ATTRIBUTE, decision.keyRecord());
        if (decision.keyRecord() != null) {
            MDC.put(RequestContextKeys.API_KEY_ID_MDC_KEY, decision.keyRecord().getKeyId());
        }
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.API_KEY_ID_MDC_KEY);
        }
    }

    private void writeError(HttpServletResponse response, HttpServletRequest request, HttpStatus status, String reason)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
                GlobalExceptionHandler.ApiError.of(status, reason, request.getRequestURI()));
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String ctx = request.getContextPath();
        return (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) ? uri.substring(ctx.length()) : uri;
    }
}
