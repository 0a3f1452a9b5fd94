package com.clapgrow.tempmail.common.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Read-only copy of a provider's request counters.
 *
 * @param totalRequests Every operation, success or failure
 * @param successfulRequests Operations that returned a successful envelope
 * @param failedRequests Operations that returned a failed envelope
 * @param averageResponseTime Running average in milliseconds, see {@code ProviderStatisticsTracker}
 * @param lastRequestTime Time of the most recent operation, null before the first one
 * @param errorsToday Failed operations counted since process start
 * @param requestsToday Operations counted since process start
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderStatistics(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double averageResponseTime,
    Instant lastRequestTime,
    long errorsToday,
    long requestsToday
) {
}
