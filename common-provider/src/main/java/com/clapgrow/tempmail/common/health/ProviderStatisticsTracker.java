package com.clapgrow.tempmail.common.health;

import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.provider.ProviderStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request counters of one provider.
 *
 * Updates from concurrent operations may interleave; the figures are
 * instrumentation, not accounting. The average response time is the running
 * {@code (previous + sample) / 2}. The "today" counters are never reset.
 */
public class ProviderStatisticsTracker {

    private final Clock clock;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong errorsToday = new AtomicLong();
    private final AtomicLong requestsToday = new AtomicLong();
    private final AtomicReference<Double> averageResponseTime = new AtomicReference<>(0.0);
    private final AtomicReference<Instant> lastRequestTime = new AtomicReference<>();
    private final AtomicReference<String> lastErrorMessage = new AtomicReference<>();
    private final AtomicReference<ProviderStatus> statusOverride = new AtomicReference<>();

    public ProviderStatisticsTracker() {
        this(Clock.systemUTC());
    }

    public ProviderStatisticsTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Record a successful operation.
     *
     * @param responseTimeMs Elapsed time, or null when no sample was taken
     */
    public void recordSuccess(Long responseTimeMs) {
        countRequest();
        successfulRequests.incrementAndGet();
        if (responseTimeMs != null) {
            averageResponseTime.updateAndGet(previous -> (previous + responseTimeMs) / 2);
        }
        statusOverride.compareAndSet(ProviderStatus.RATE_LIMITED, null);
    }

    /**
     * Record a failed operation.
     *
     * @param errorMessage Message of the typed error
     */
    public void recordFailure(String errorMessage) {
        countRequest();
        failedRequests.incrementAndGet();
        errorsToday.incrementAndGet();
        if (errorMessage != null) {
            lastErrorMessage.set(errorMessage);
        }
    }

    private void countRequest() {
        totalRequests.incrementAndGet();
        requestsToday.incrementAndGet();
        lastRequestTime.set(clock.instant());
    }

    /**
     * Force a status reported instead of the probe-derived one.
     *
     * @param status RATE_LIMITED or MAINTENANCE, null to clear
     */
    public void overrideStatus(ProviderStatus status) {
        statusOverride.set(status);
    }

    public ProviderStatus getStatusOverride() {
        return statusOverride.get();
    }

    /**
     * Percentage of successful requests, 0 before the first one.
     */
    public double successRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) successfulRequests.get() / total * 100 : 0;
    }

    public ProviderStatistics snapshot() {
        return new ProviderStatistics(
            totalRequests.get(),
            successfulRequests.get(),
            failedRequests.get(),
            averageResponseTime.get(),
            lastRequestTime.get(),
            errorsToday.get(),
            requestsToday.get()
        );
    }

    /**
     * Combine the counters with a probe outcome into a health snapshot.
     *
     * @param probe Cached probe result
     * @return Derived health
     */
    public ProviderHealth toHealth(ProbeResult probe) {
        ProviderStatus override = statusOverride.get();
        ProviderStatus status = override != null
            ? override
            : probe.success() ? ProviderStatus.ACTIVE : ProviderStatus.ERROR;
        double rate = successRate();
        String lastError = probe.error() != null ? probe.error() : lastErrorMessage.get();
        return new ProviderHealth(status, probe.checkedAt(), probe.responseTime(),
            failedRequests.get(), rate, lastError, rate);
    }
}
