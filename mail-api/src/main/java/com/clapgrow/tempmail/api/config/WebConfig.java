package com.clapgrow.tempmail.api.config;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    static final String[] PROTECTED_PATHS = {
        "/api/mail/create",
        "/api/mail/list",
        "/api/mail/content",
        "/api/mail/providers/health/refresh"
    };

    private final ApiKeyAuthInterceptor apiKeyAuthInterceptor;

    @Value("${cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${cors.allowed-methods:GET,POST,OPTIONS}")
    private String[] allowedMethods;

    @Value("${cors.allowed-headers:*}")
    private String[] allowedHeaders;

    @Value("${cors.max-age:3600}")
    private long maxAge;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // Health, stats and connection tests stay public
        registry.addInterceptor(apiKeyAuthInterceptor)
                .addPathPatterns(PROTECTED_PATHS);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        boolean hasWildcard = Arrays.stream(allowedOrigins)
                .anyMatch(origin -> "*".equals(origin));

        var apiMapping = registry.addMapping("/api/**")
                .allowedMethods(allowedMethods)
                .allowedHeaders(allowedHeaders)
                .allowCredentials(true)
                .maxAge(maxAge);

        if (hasWildcard) {
            // Wildcard with credentials requires origin patterns
            apiMapping.allowedOriginPatterns("*");
        } else {
            apiMapping.allowedOrigins(allowedOrigins);
        }
    }
}
