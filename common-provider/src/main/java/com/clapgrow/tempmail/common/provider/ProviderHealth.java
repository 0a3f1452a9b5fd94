package com.clapgrow.tempmail.common.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Point-in-time health of one provider.
 *
 * Derived, never stored: recomputed from the statistics counter and the cached
 * connectivity probe every time it is requested.
 *
 * @param status Operational status
 * @param lastChecked When the (possibly cached) probe ran
 * @param responseTime Probe latency in milliseconds, if measured
 * @param errorCount Cumulative failed requests
 * @param successRate Successful / total requests, 0-100
 * @param lastError Most recent probe or operation error message
 * @param uptime Currently the same figure as {@code successRate}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderHealth(
    ProviderStatus status,
    Instant lastChecked,
    Long responseTime,
    long errorCount,
    double successRate,
    String lastError,
    double uptime
) {

    /**
     * Synthetic snapshot used when a provider's health could not be collected at all.
     *
     * @param lastError Failure message
     * @param checkedAt Collection time
     * @return ERROR snapshot with zeroed figures
     */
    public static ProviderHealth unavailable(String lastError, Instant checkedAt) {
        return new ProviderHealth(ProviderStatus.ERROR, checkedAt, null, 1, 0, lastError, 0);
    }
}
