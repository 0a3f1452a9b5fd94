package com.clapgrow.tempmail.api.config;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer API key check for the protected mail routes.
 *
 * SECURITY MODEL:
 * - Routes are selected in WebConfig; this interceptor only checks the key
 * - A blank tempmail.security.api-key disables the check entirely
 * - Rejections are raised as SecurityException and rendered as 401 by GlobalExceptionHandler
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAuthInterceptor implements HandlerInterceptor {

    static final String MISSING_KEY_MESSAGE =
        "Missing API key. Please provide Authorization header with Bearer token.";
    static final String INVALID_KEY_MESSAGE =
        "Invalid API key. Please provide a valid Bearer token.";

    private static final String BEARER_PREFIX = "Bearer ";

    private final TempMailProperties properties;

    @PostConstruct
    void logMode() {
        if (properties.isAuthenticationEnabled()) {
            log.info("API key authentication enabled for protected mail routes");
        } else {
            log.warn("API key authentication disabled: tempmail.security.api-key is not set");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // CORS preflight reaches interceptors before controllers
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        if (!properties.isAuthenticationEnabled()) {
            return true;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX) || header.substring(BEARER_PREFIX.length()).isBlank()) {
            log.warn("Rejected {} {}: missing API key", request.getMethod(), request.getRequestURI());
            throw new SecurityException(MISSING_KEY_MESSAGE);
        }

        String presented = header.substring(BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8),
                properties.getSecurity().getApiKey().getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {}: invalid API key", request.getMethod(), request.getRequestURI());
            throw new SecurityException(INVALID_KEY_MESSAGE);
        }
        return true;
    }
}
