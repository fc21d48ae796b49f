package com.github.dimitryivaniuta.keyguard.config;

import com.github.dimitryivaniuta.keyguard.decision.ApiKeyHeaderParser;
import com.github.dimitryivaniuta.keyguard.decision.Decision;
import com.github.dimitryivaniuta.keyguard.web.RequestContextKeys;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    CorsFilter corsFilter() {
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOrigins(List.of("http://localhost:3000"));
        c.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        c.setAllowedHeaders(List.of(
                "Content-Type",
                ApiKeyHeaderParser.HEADER,
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        // clients need the rate limit headers to back off
        c.setExposedHeaders(List.of(
                Decision.HEADER_LIMIT,
                Decision.HEADER_REMAINING,
                Decision.HEADER_RESET,
                Decision.HEADER_ALGORITHM,
                Decision.HEADER_RETRY_AFTER,
                RequestContextKeys.CORRELATION_ID_HEADER
        ));
        c.setAllowCredentials(false);
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);
        return new CorsFilter(src);
    }
}
