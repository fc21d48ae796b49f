package com.github.dimitryivaniuta.keyguard.web;

import jakarta.servlet.http.HttpServletRequest;

final class ClientIpResolver {

    private ClientIpResolver() {}

    static String resolve(HttpServletRequest req, boolean trustForwardedHeaders) {
        if (trustForwardedHeaders) {
            // X-Forwarded-For may contain "client, proxy1, proxy2"
            String xff = header(req, "X-Forwarded-For");
            if (xff != null) {
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isBlank()) return first;
            }
            String realIp = header(req, "X-Real-IP");
            if (realIp != null) return realIp;
        }
        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? null : ra;
    }

    static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
