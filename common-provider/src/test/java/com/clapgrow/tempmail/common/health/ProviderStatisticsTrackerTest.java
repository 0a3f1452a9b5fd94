package com.clapgrow.tempmail.common.health;

import com.clapgrow.tempmail.common.provider.ProviderHealth;
import com.clapgrow.tempmail.common.provider.ProviderStatistics;
import com.clapgrow.tempmail.common.provider.ProviderStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ProviderStatisticsTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ProviderStatisticsTracker tracker = new ProviderStatisticsTracker(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void testCountersAfterSuccessesAndFailures() {
        tracker.recordSuccess(100L);
        tracker.recordSuccess(200L);
        tracker.recordSuccess(null);
        tracker.recordFailure("timeout");
        tracker.recordFailure("rate limited");

        ProviderStatistics statistics = tracker.snapshot();

        assertEquals(5, statistics.totalRequests());
        assertEquals(3, statistics.successfulRequests());
        assertEquals(2, statistics.failedRequests());
        assertEquals(2, statistics.errorsToday());
        assertEquals(5, statistics.requestsToday());
        assertEquals(NOW, statistics.lastRequestTime());
        assertEquals(60.0, tracker.successRate(), 0.0001);
    }

    @Test
    void testRunningAverageHalvesTowardsLatestSample() {
        tracker.recordSuccess(100L);
        assertEquals(50.0, tracker.snapshot().averageResponseTime(), 0.0001);
        tracker.recordSuccess(200L);
        assertEquals(125.0, tracker.snapshot().averageResponseTime(), 0.0001);
    }

    @Test
    void testNoRequestsMeansZeroSuccessRate() {
        ProviderHealth health = tracker.toHealth(ProbeResult.succeeded(NOW, 42));

        assertEquals(ProviderStatus.ACTIVE, health.status());
        assertEquals(0.0, health.successRate());
        assertEquals(health.successRate(), health.uptime());
        assertNull(health.lastError());
        assertEquals(42L, health.responseTime());
    }

    @Test
    void testFailedProbeReportsErrorAndProbeMessage() {
        tracker.recordFailure("older operation failure");

        ProviderHealth health = tracker.toHealth(ProbeResult.failed(NOW, 10L, "connection refused"));

        assertEquals(ProviderStatus.ERROR, health.status());
        assertEquals("connection refused", health.lastError());
        assertEquals(1, health.errorCount());
    }

    @Test
    void testLastOperationErrorUsedWhenProbeSucceeded() {
        tracker.recordFailure("Email with ID 9 not found");

        assertEquals("Email with ID 9 not found", tracker.toHealth(ProbeResult.succeeded(NOW, 5)).lastError());
    }

    @Test
    void testRateLimitedOverrideClearedBySuccess() {
        tracker.overrideStatus(ProviderStatus.RATE_LIMITED);
        assertEquals(ProviderStatus.RATE_LIMITED, tracker.toHealth(ProbeResult.succeeded(NOW, 5)).status());

        tracker.recordSuccess(10L);

        assertNull(tracker.getStatusOverride());
        assertEquals(ProviderStatus.ACTIVE, tracker.toHealth(ProbeResult.succeeded(NOW, 5)).status());
    }

    @Test
    void testMaintenanceOverrideSurvivesSuccess() {
        tracker.overrideStatus(ProviderStatus.MAINTENANCE);
        tracker.recordSuccess(10L);

        assertEquals(ProviderStatus.MAINTENANCE, tracker.toHealth(ProbeResult.succeeded(NOW, 5)).status());
    }
}
