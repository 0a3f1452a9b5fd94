package com.clapgrow.tempmail.common.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Per-provider settings.
 *
 * Owned by configuration; an adapter receives this immutable value in
 * {@link MailProvider#initialize(ProviderConfiguration)} and never changes it.
 *
 * Defaults match a fresh provider entry: enabled, priority 1, 10s timeout, 2 retries,
 * 30 requests per 60 seconds.
 */
@Value
@Builder(toBuilder = true)
public class ProviderConfiguration {

    String name;

    @Builder.Default
    boolean enabled = true;

    /**
     * Lower value = preferred when enabled providers are ordered.
     */
    @Builder.Default
    int priority = 1;

    String baseUrl;

    /**
     * Vendor API key. Never log this value.
     */
    @ToString.Exclude
    String apiKey;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(10);

    @Builder.Default
    int retries = 2;

    @Builder.Default
    RateLimit rateLimit = new RateLimit(30, Duration.ofSeconds(60));

    @Singular
    Map<String, String> headers;

    @Singular
    List<String> domains;

    /**
     * Check whether an API key is present.
     *
     * @return true if a non-blank key is configured
     */
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Advisory request budget: {@code requests} per {@code window}. Not enforced by the gateway.
     */
    public record RateLimit(int requests, Duration window) {
    }
}
