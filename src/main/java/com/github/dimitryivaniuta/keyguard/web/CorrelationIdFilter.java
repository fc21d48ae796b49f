package com.github.dimitryivaniuta.keyguard.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a correlation id in the MDC for every request so decision logs and error bodies can be tied together.
 * An incoming id longer than 64 characters is replaced.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final int MAX_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String corr = request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER);
        if (corr == null || corr.isBlank() || corr.length() > MAX_LENGTH) {
            corr = UUID.randomUUID().toString();
        }

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }
}
