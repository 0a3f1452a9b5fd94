package com.clapgrow.tempmail.api.config;

import com.clapgrow.tempmail.common.provider.ProviderConfiguration;
import com.clapgrow.tempmail.common.routing.ProviderRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway settings.
 *
 * Maps to:
 * tempmail:
 *   security:
 *     api-key: ${TEMPMAIL_SECURITY_API_KEY:}
 *   http:
 *     retry-base-delay: 1s
 *   providers:
 *     minmail:
 *       enabled: true
 *       priority: 1
 *       timeout: 10s
 *       retries: 2
 *
 * Providers missing from the map fall back to their built-in defaults.
 */
@ConfigurationProperties(prefix = "tempmail")
@Validated
@Data
public class TempMailProperties {

    private static final Map<String, Provider> DEFAULTS = Map.of(
        "minmail", Provider.of(1, Duration.ofSeconds(10), 2, 30),
        "tempmailplus", Provider.of(2, Duration.ofSeconds(8), 3, 50),
        "mailtm", Provider.of(3, Duration.ofSeconds(12), 2, 20),
        "etempmail", Provider.of(4, Duration.ofSeconds(15), 2, 25),
        "vanishpost", Provider.of(5, Duration.ofSeconds(10), 1, 4, Duration.ofSeconds(900)),
        "chattempmail", Provider.of(6, Duration.ofSeconds(10), 2, 30)
    );

    @Valid
    private Security security = new Security();

    @Valid
    private Http http = new Http();

    /**
     * Router preference when several enabled providers qualify.
     */
    private List<String> performanceOrder = new ArrayList<>(ProviderRegistry.DEFAULT_PERFORMANCE_ORDER);

    @Valid
    private Map<String, Provider> providers = new LinkedHashMap<>();

    /**
     * Settings of one provider: the configured entry, else the built-in default.
     *
     * @param name Provider name
     * @return Provider settings, never null
     */
    public Provider provider(String name) {
        Provider configured = providers.get(name);
        if (configured != null) {
            return configured;
        }
        Provider fallback = DEFAULTS.get(name);
        return fallback != null ? fallback : new Provider();
    }

    public boolean isAuthenticationEnabled() {
        return security.getApiKey() != null && !security.getApiKey().isBlank();
    }

    @Data
    public static class Security {

        /**
         * Bearer key required on protected routes. Blank disables authentication.
         */
        private String apiKey;
    }

    @Data
    public static class Http {

        /**
         * Linear backoff step between transport retries.
         */
        @NotNull
        private Duration retryBaseDelay = Duration.ofSeconds(1);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Provider {

        private boolean enabled = true;

        @Min(1)
        private int priority = 1;

        private String baseUrl;

        private String apiKey;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @Min(0)
        private int retries = 2;

        @Min(1)
        private int rateLimitRequests = 30;

        @NotNull
        private Duration rateLimitWindow = Duration.ofSeconds(60);

        private Map<String, String> headers = new LinkedHashMap<>();

        private List<String> domains = new ArrayList<>();

        static Provider of(int priority, Duration timeout, int retries, int rateLimitRequests) {
            return of(priority, timeout, retries, rateLimitRequests, Duration.ofSeconds(60));
        }

        static Provider of(int priority, Duration timeout, int retries, int rateLimitRequests,
                           Duration rateLimitWindow) {
            Provider provider = new Provider();
            provider.setPriority(priority);
            provider.setTimeout(timeout);
            provider.setRetries(retries);
            provider.setRateLimitRequests(rateLimitRequests);
            provider.setRateLimitWindow(rateLimitWindow);
            return provider;
        }

        @AssertTrue(message = "timeout must be at least 1s")
        public boolean isTimeoutValid() {
            return timeout == null || timeout.compareTo(Duration.ofSeconds(1)) >= 0;
        }

        public ProviderConfiguration toConfiguration(String name) {
            return ProviderConfiguration.builder()
                .name(name)
                .enabled(enabled)
                .priority(priority)
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .timeout(timeout)
                .retries(retries)
                .rateLimit(new ProviderConfiguration.RateLimit(rateLimitRequests, rateLimitWindow))
                .headers(headers)
                .domains(domains)
                .build();
        }
    }
}
